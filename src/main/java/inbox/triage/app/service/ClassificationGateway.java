package inbox.triage.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import inbox.triage.app.model.Classification;
import inbox.triage.app.model.MailMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Classifies a message through the language model. Never throws: any failure yields
 * {@link Classification#fallback(String)}.
 */
@Slf4j
@Service
public class ClassificationGateway {
    private static final int MAX_TOKENS = 600;
    private static final double TEMPERATURE = 0.2;

    private final LanguageModelClient languageModelClient;
    private final ClassificationPromptBuilder promptBuilder;
    private final VerdictParser verdictParser;
    private final ClassificationDecoder decoder;

    public ClassificationGateway(
            LanguageModelClient languageModelClient,
            ClassificationPromptBuilder promptBuilder,
            VerdictParser verdictParser,
            ClassificationDecoder decoder) {
        this.languageModelClient = languageModelClient;
        this.promptBuilder = promptBuilder;
        this.verdictParser = verdictParser;
        this.decoder = decoder;
    }

    public Classification classify(MailMessage message) {
        try {
            String prompt = promptBuilder.build(message);
            String response = languageModelClient.complete(prompt, MAX_TOKENS, TEMPERATURE, true);

            Optional<JsonNode> verdict = verdictParser.parse(response);
            if (verdict.isEmpty()) {
                log.warn("Unparseable verdict from {} for message {}", languageModelClient.providerName(), message.getId());
                return Classification.fallback("unparseable classifier response");
            }
            Classification classification = decoder.decode(verdict.get(), message);
            log.debug("Message {} classified as {} ({})", message.getId(),
                    classification.getCategory().getWireName(), classification.getConfidence());
            return classification;
        } catch (LanguageModelClient.QuotaException e) {
            log.warn("Classifier quota exceeded for message {}: {}", message.getId(), e.getMessage());
            return Classification.fallback("quota exceeded: " + e.getMessage());
        } catch (Exception e) {
            log.warn("Classification failed for message {}: {}", message.getId(), e.getMessage());
            return Classification.fallback(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
