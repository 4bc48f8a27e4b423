package com.rekindle.rex.core.decision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks personal data before a decision context leaves the process or lands in the audit trail.
 * <p>
 * Values under sensitive keys are replaced wholesale; e-mail addresses and phone numbers embedded
 * in any other string value are masked in place.
 */
public class ContextRedactor {

    static final String MASK = "[REDACTED]";

    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "email", "phone", "ssn", "credit_card", "creditcard", "api_key", "apikey",
            "password", "token", "secret", "address"
    );

    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d\\s().-]{7,}\\d");

    private final ObjectMapper mapper;

    public ContextRedactor(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Serializes the context to a JSON tree with personal data masked.
     */
    public ObjectNode redact(DecisionContext context) {
        ObjectNode tree = mapper.valueToTree(context);
        tree.put("requestType", context.requestType().name());
        return (ObjectNode) masked(tree);
    }

    public JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return mapper.nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = mapper.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = mapper.createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            return mapper.getNodeFactory().textNode(maskText(input.asText()));
        }
        return input;
    }

    static String maskText(String value) {
        String masked = EMAIL.matcher(value).replaceAll(MASK);
        return PHONE.matcher(masked).replaceAll(MASK);
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
