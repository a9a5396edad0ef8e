package inbox.triage.app.service;

import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionChoice;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Slf4j
public class OpenAiLanguageModelClient implements LanguageModelClient {
    private static final String JSON_SYSTEM_PROMPT =
            "You are an email triage assistant. Reply with a single JSON object and nothing else.";

    private final OpenAiService openAiService;
    private final String model;

    public OpenAiLanguageModelClient(OpenAiService openAiService, String model) {
        this.openAiService = openAiService;
        this.model = model;
    }

    @Override
    public String complete(String prompt, int maxTokens, double temperature, boolean jsonOutput) {
        try {
            List<ChatMessage> messages = new ArrayList<>();
            if (jsonOutput) {
                messages.add(new ChatMessage("system", JSON_SYSTEM_PROMPT));
            }
            messages.add(new ChatMessage("user", prompt));

            ChatCompletionRequest request = ChatCompletionRequest.builder()
                    .model(model)
                    .messages(messages)
                    .maxTokens(maxTokens)
                    .temperature(temperature)
                    .build();

            List<ChatCompletionChoice> choices = openAiService.createChatCompletion(request).getChoices();
            if (choices == null || choices.isEmpty() || choices.get(0).getMessage() == null) {
                throw new IllegalStateException("OpenAI returned no choices");
            }
            String content = choices.get(0).getMessage().getContent();
            return content != null ? content.trim() : "";
        } catch (Exception e) {
            throw translate(e);
        }
    }

    @Override
    public String providerName() {
        return "openai";
    }

    private RuntimeException translate(Exception e) {
        String errorMessage = e.getMessage() != null ? e.getMessage().toLowerCase(Locale.ROOT) : "";

        if ((e instanceof OpenAiHttpException && ((OpenAiHttpException) e).statusCode == 429)
                || errorMessage.contains("quota")
                || errorMessage.contains("rate limit")
                || (e.getCause() != null && e.getCause().getMessage() != null
                    && e.getCause().getMessage().contains("429"))) {
            return new QuotaException("OpenAI quota/rate limit exceeded: " + e.getMessage(), e);
        }
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return new RuntimeException("OpenAI API error: " + e.getMessage(), e);
    }
}
