package inbox.triage.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a JSON payload from free-form model output. Tried in order: the whole text,
 * the contents of a fenced code block, then the first balanced {...} span.
 */
@Slf4j
@Component
public class VerdictParser {
    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:[a-zA-Z]+)?\\s*\\n?(.*?)```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public VerdictParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<JsonNode> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        Optional<JsonNode> direct = tryRead(text.trim());
        if (direct.isPresent()) {
            return direct;
        }

        Matcher fenced = FENCED_BLOCK.matcher(text);
        if (fenced.find()) {
            Optional<JsonNode> inner = tryRead(fenced.group(1).trim());
            if (inner.isPresent()) {
                return inner;
            }
        }

        return firstBalancedObject(text).flatMap(this::tryRead);
    }

    private Optional<JsonNode> tryRead(String candidate) {
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node == null || node.isMissingNode() || !node.isContainerNode()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException e) {
            log.debug("Candidate is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Finds the first {...} span whose braces balance, ignoring braces inside JSON strings.
     */
    static Optional<String> firstBalancedObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == '"') {
                        inString = false;
                    }
                    continue;
                }
                if (c == '"') {
                    inString = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return Optional.of(text.substring(start, i + 1));
                    }
                }
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }
}
