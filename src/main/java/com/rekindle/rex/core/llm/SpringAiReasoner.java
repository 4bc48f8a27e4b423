package com.rekindle.rex.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Network-backed {@link Reasoner} built on Spring AI's {@link ChatClient}.
 * <p>
 * Uses {@link BeanOutputConverter} to append the JSON schema of {@link ReasonerResult} to the
 * prompt and to deserialize the answer. Transport and parse failures surface as
 * {@link ReasonerException}; validating the decision against the allowed values is left to
 * the caller.
 */
public class SpringAiReasoner implements Reasoner {

    private static final Logger log = LoggerFactory.getLogger(SpringAiReasoner.class);

    static final String SYSTEM_PROMPT = """
            You are Rex, the orchestration core of a lead-outreach automation system.
            You are consulted only when deterministic rules could not answer a question.
            Protect sending-domain reputation and provider rate limits above throughput.
            Answer with exactly one of the allowed decision values and a confidence between 0 and 1.
            Prefer the most conservative option when the facts are insufficient.""";

    private final ChatClient chatClient;
    private final int maxContextChars;
    private final ObjectMapper mapper = new ObjectMapper();

    public SpringAiReasoner(ChatClient.Builder builder, LlmProperties properties) {
        this.chatClient = builder.build();
        this.maxContextChars = properties.getMaxContextChars();
        log.info("SpringAiReasoner initialized (max context {} chars)", maxContextChars);
    }

    @Override
    public ReasonerResult resolve(ReasonerRequest request) throws ReasonerException {
        log.info("LLM call started → {}", request.requestType());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(ReasonerResult.class);
        try {
            String response = chatClient.prompt()
                    .system(SYSTEM_PROMPT)
                    .user(userPrompt(request) + "\n\n" + converter.getFormat())
                    .call()
                    .content();
            long elapsed = System.currentTimeMillis() - start;
            log.info("LLM call complete → {} ({}s)", request.requestType(), String.format("%.1f", elapsed / 1000.0));
            if (response == null || response.isBlank()) {
                throw new LlmEmptyResponseException("LLM returned empty content for " + request.requestType());
            }
            try {
                return converter.convert(response);
            } catch (RuntimeException e) {
                log.warn("Failed to parse LLM response for {}: {}", request.requestType(), e.getMessage());
                log.debug("Raw LLM response: {}", response);
                return parseWithJackson(response);
            }
        } catch (LlmEmptyResponseException | LlmParseException e) {
            throw new ReasonerException(e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ReasonerException("Reasoning provider call failed: " + e.getMessage(), e);
        }
    }

    String userPrompt(ReasonerRequest request) {
        String context = fitContext(request.requestType(), request.contextJson());
        return "Question: " + request.requestType() + "\n"
                + "Allowed decisions: " + String.join(", ", request.allowedValues().stream().sorted().toList()) + "\n"
                + "Context:\n" + context;
    }

    /**
     * Shrinks an oversized context by dropping whole fields, largest first, so the provider
     * always receives valid JSON.
     */
    String fitContext(String requestType, String contextJson) {
        if (contextJson.length() <= maxContextChars) {
            return contextJson;
        }
        JsonNode parsed;
        try {
            parsed = mapper.readTree(contextJson);
        } catch (JsonProcessingException e) {
            parsed = null;
        }
        if (!(parsed instanceof ObjectNode node)) {
            log.warn("Context for {} is {} chars and not a JSON object, cutting it to {} chars",
                    requestType, contextJson.length(), maxContextChars);
            return contextJson.substring(0, maxContextChars);
        }
        List<String> dropped = new ArrayList<>();
        String fitted = node.toString();
        while (fitted.length() > maxContextChars && node.size() > 0) {
            String largest = largestField(node);
            node.remove(largest);
            dropped.add(largest);
            fitted = node.toString();
        }
        log.warn("Context for {} is {} chars, over the {} char limit; dropped fields {}",
                requestType, contextJson.length(), maxContextChars, dropped);
        return fitted;
    }

    private static String largestField(ObjectNode node) {
        String largest = null;
        int largestSize = -1;
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            int size = field.getKey().length() + field.getValue().toString().length();
            if (size > largestSize) {
                largest = field.getKey();
                largestSize = size;
            }
        }
        return largest;
    }

    /**
     * Lenient fallback for answers wrapped in markdown fences or carrying extra fields.
     */
    private ReasonerResult parseWithJackson(String json) {
        try {
            var mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

            String cleaned = json.trim();
            if (cleaned.startsWith("```json")) {
                cleaned = cleaned.substring(7);
            } else if (cleaned.startsWith("```")) {
                cleaned = cleaned.substring(3);
            }
            if (cleaned.endsWith("```")) {
                cleaned = cleaned.substring(0, cleaned.length() - 3);
            }
            return mapper.readValue(cleaned.trim(), ReasonerResult.class);
        } catch (Exception e) {
            log.error("Jackson fallback parsing FAILED for reasoner response: {}", e.getMessage());
            throw new LlmParseException("Failed to parse reasoner response: " + e.getMessage(), e);
        }
    }
}
