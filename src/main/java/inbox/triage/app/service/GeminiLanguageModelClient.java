package inbox.triage.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Google Gemini implementation over the generateContent REST endpoint.
 */
@Slf4j
public class GeminiLanguageModelClient implements LanguageModelClient {
    private static final String GEMINI_API_URL = "https://generativelanguage.googleapis.com/v1beta/models/%s:generateContent";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;

    public GeminiLanguageModelClient(String apiKey, String model) {
        this(new RestTemplate(), new ObjectMapper(), apiKey, model);
    }

    GeminiLanguageModelClient(RestTemplate restTemplate, ObjectMapper objectMapper, String apiKey, String model) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;

        if (!isConfigured()) {
            log.warn("Gemini API key not configured. Set gemini.api.key in application.properties or environment variable.");
        }
    }

    @Override
    public String complete(String prompt, int maxTokens, double temperature, boolean jsonOutput) {
        if (!isConfigured()) {
            throw new IllegalStateException("Gemini API key not configured");
        }

        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            Map<String, Object> part = new HashMap<>();
            part.put("text", prompt);
            Map<String, Object> contents = new HashMap<>();
            contents.put("parts", List.of(part));

            Map<String, Object> generationConfig = new HashMap<>();
            generationConfig.put("maxOutputTokens", maxTokens);
            generationConfig.put("temperature", temperature);
            if (jsonOutput) {
                generationConfig.put("responseMimeType", "application/json");
            }

            Map<String, Object> requestBody = new HashMap<>();
            requestBody.put("contents", List.of(contents));
            requestBody.put("generationConfig", generationConfig);

            String url = String.format(GEMINI_API_URL, model) + "?key=" + apiKey;
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(requestBody, headers), String.class);

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new IllegalStateException("Gemini API error: " + response.getStatusCode());
            }
            return extractText(response.getBody());
        } catch (Exception e) {
            throw translate(e);
        }
    }

    @Override
    public String providerName() {
        return "gemini";
    }

    String extractText(String responseBody) throws Exception {
        JsonNode jsonResponse = objectMapper.readTree(responseBody);
        JsonNode parts = jsonResponse.path("candidates").path(0).path("content").path("parts");
        if (parts.isArray() && parts.size() > 0 && parts.get(0).has("text")) {
            return parts.get(0).get("text").asText().trim();
        }
        throw new IllegalStateException("Unexpected Gemini API response format");
    }

    private boolean isConfigured() {
        return apiKey != null && !apiKey.isEmpty() && !apiKey.startsWith("${");
    }

    private RuntimeException translate(Exception e) {
        String errorMessage = e.getMessage() != null ? e.getMessage().toLowerCase(Locale.ROOT) : "";

        if (errorMessage.contains("quota")
                || errorMessage.contains("rate limit")
                || errorMessage.contains("429")
                || errorMessage.contains("resource exhausted")) {
            return new QuotaException("Gemini quota/rate limit exceeded: " + e.getMessage(), e);
        }
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return new RuntimeException("Gemini API error: " + e.getMessage(), e);
    }
}
