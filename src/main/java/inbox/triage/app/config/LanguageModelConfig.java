package inbox.triage.app.config;

import com.theokanning.openai.service.OpenAiService;
import inbox.triage.app.service.GeminiLanguageModelClient;
import inbox.triage.app.service.LanguageModelClient;
import inbox.triage.app.service.OpenAiLanguageModelClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;

/**
 * Configuration to switch between AI providers.
 * Set ai.provider=gemini or ai.provider=openai in application.properties
 */
@Configuration
public class LanguageModelConfig {

    @Bean
    @Primary
    @ConditionalOnProperty(name = "ai.provider", havingValue = "gemini")
    public LanguageModelClient geminiLanguageModelClient(
            @Value("${gemini.api.key:}") String apiKey,
            @Value("${gemini.model:gemini-1.5-flash}") String model) {
        return new GeminiLanguageModelClient(apiKey, model);
    }

    @Bean
    @Primary
    @ConditionalOnProperty(name = "ai.provider", havingValue = "openai", matchIfMissing = true)
    public LanguageModelClient openAiLanguageModelClient(
            @Value("${openai.api.key:}") String apiKey,
            @Value("${openai.model:gpt-4o-mini}") String model,
            @Value("${openai.timeout-seconds:60}") long timeoutSeconds) {
        OpenAiService openAiService = new OpenAiService(apiKey, Duration.ofSeconds(timeoutSeconds));
        return new OpenAiLanguageModelClient(openAiService, model);
    }
}
