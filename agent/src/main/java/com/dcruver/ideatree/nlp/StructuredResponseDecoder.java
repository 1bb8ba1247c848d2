package com.dcruver.ideatree.nlp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a JSON object or array from free-form model output.
 *
 * Repairs are tried from least to most destructive: the text as-is, then with raw
 * newlines inside strings flattened, then with missing closers appended, then both.
 * Only when the whole text resists all of these does it fall back to a fenced code
 * block, and after that to the widest brace- or bracket-delimited substring.
 */
@Component
@Slf4j
public class StructuredResponseDecoder {

    private static final Pattern CODE_FENCE =
        Pattern.compile("```(?:json)?\\s*(.*?)(?:```|\\z)", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private static final List<UnaryOperator<String>> REPAIRS = List.of(
        UnaryOperator.identity(),
        StructuredResponseDecoder::sanitize,
        StructuredResponseDecoder::closeIncomplete,
        text -> closeIncomplete(sanitize(text))
    );

    private final ObjectMapper objectMapper;

    public StructuredResponseDecoder() {
        this.objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Decode the model output into an object or array node.
     *
     * @throws DecodeException when no strategy yields a JSON container
     */
    public JsonNode decode(String text) {
        if (text == null || text.isBlank()) {
            throw new DecodeException("Model response was empty", text);
        }
        String trimmed = text.strip();

        JsonNode result = tryRepairs(trimmed);
        if (result != null) {
            return result;
        }

        Matcher fence = CODE_FENCE.matcher(trimmed);
        if (fence.find()) {
            result = tryRepairs(fence.group(1).strip());
            if (result != null) {
                log.debug("Recovered JSON from fenced block");
                return result;
            }
        }

        result = tryDelimited(trimmed, '{', '}');
        if (result == null) {
            result = tryDelimited(trimmed, '[', ']');
        }
        if (result != null) {
            log.debug("Recovered JSON from delimited substring");
            return result;
        }

        log.warn("Could not decode model response: {}", truncate(trimmed, 200));
        throw new DecodeException("No JSON value could be recovered from the model response", text);
    }

    private JsonNode tryDelimited(String text, char open, char close) {
        int start = text.indexOf(open);
        if (start < 0) {
            return null;
        }
        int end = text.lastIndexOf(close);
        String chunk = end > start ? text.substring(start, end + 1) : text.substring(start);
        return tryRepairs(chunk);
    }

    private JsonNode tryRepairs(String candidate) {
        for (UnaryOperator<String> repair : REPAIRS) {
            JsonNode node = parse(repair.apply(candidate));
            if (node != null) {
                return node;
            }
        }
        return null;
    }

    private JsonNode parse(String candidate) {
        if (candidate.isEmpty()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isContainerNode() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * Replace raw line breaks that sit inside string literals with a space.
     */
    static String sanitize(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                out.append(c);
                escaped = false;
            } else if (c == '\\') {
                out.append(c);
                escaped = true;
            } else if (c == '"') {
                out.append(c);
                inString = !inString;
            } else if ((c == '\n' || c == '\r') && inString) {
                out.append(' ');
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Append whatever a truncated document is missing: a closing quote when it stops
     * inside a string, then the closers of every still-open object or array.
     */
    static String closeIncomplete(String text) {
        Deque<Character> closers = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
                continue;
            }
            if (c == '\\') {
                escaped = inString;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) {
                continue;
            }
            switch (c) {
                case '{' -> closers.push('}');
                case '[' -> closers.push(']');
                case '}', ']' -> {
                    if (!closers.isEmpty() && closers.peek() == c) {
                        closers.pop();
                    }
                }
                default -> {
                }
            }
        }

        StringBuilder out = new StringBuilder(text);
        if (inString) {
            out.append('"');
        } else if (!closers.isEmpty()) {
            trimDanglingSeparator(out);
        }
        while (!closers.isEmpty()) {
            out.append(closers.pop());
        }
        return out.toString();
    }

    private static void trimDanglingSeparator(StringBuilder out) {
        int end = out.length();
        while (end > 0 && Character.isWhitespace(out.charAt(end - 1))) {
            end--;
        }
        if (end > 0 && out.charAt(end - 1) == ',') {
            out.setLength(end - 1);
        } else if (end > 0 && out.charAt(end - 1) == ':') {
            out.setLength(end);
            out.append("null");
        }
    }

    private static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "...";
    }
}
