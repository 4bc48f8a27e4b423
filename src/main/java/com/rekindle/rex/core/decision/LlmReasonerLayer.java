package com.rekindle.rex.core.decision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.rekindle.rex.core.llm.Reasoner;
import com.rekindle.rex.core.llm.ReasonerRequest;
import com.rekindle.rex.core.llm.ReasonerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Layer 3: consults the {@link Reasoner} for questions the rules deferred.
 * <p>
 * Each call runs on a dedicated pool and is bounded by a hard timeout. Any failure (timeout,
 * provider error, unknown decision, missing or non-numeric confidence) yields the conservative
 * default handed in by the rule layer, marked {@link DecisionLayer#LLM_FALLBACK} with confidence 0.
 * Valid answers are cached by request type and normalised context; fallbacks are never cached.
 */
public class LlmReasonerLayer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LlmReasonerLayer.class);

    private final Reasoner reasoner;
    private final Duration timeout;
    private final Cache<String, Cached> cache;
    private final ExecutorService executor;
    private final ObjectMapper mapper;
    private final ObjectWriter canonicalWriter;

    public LlmReasonerLayer(Reasoner reasoner, ObjectMapper mapper, DecisionProperties props) {
        this(reasoner, mapper, props, Ticker.systemTicker());
    }

    public LlmReasonerLayer(Reasoner reasoner, ObjectMapper mapper, DecisionProperties props, Ticker ticker) {
        this.reasoner = reasoner;
        this.timeout = props.getLlmTimeout();
        this.mapper = mapper;
        this.canonicalWriter = mapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.cache = Caffeine.newBuilder()
                .maximumSize(props.getCacheMaxEntries())
                .expireAfterWrite(props.getCacheTtl())
                .ticker(ticker)
                .build();
        this.executor = Executors.newFixedThreadPool(props.getReasonerThreads(), new ReasonerThreadFactory());
    }

    /**
     * @param requestType  the question
     * @param redacted     redacted context, as produced by {@link ContextRedactor}
     * @param fallback     value to answer with if the reasoner cannot
     */
    ReasonerAnswer reason(RequestType requestType, ObjectNode redacted, String fallback) {
        String contextJson;
        String key;
        try {
            contextJson = normalise(redacted);
            key = requestType.name() + ":" + sha256(contextJson);
        } catch (JsonProcessingException e) {
            log.warn("Could not normalise context for {}: {}", requestType, e.getMessage());
            return ReasonerAnswer.fallback(fallback, "context not serializable");
        }

        Cached cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Reasoner cache hit for {}", requestType);
            return new ReasonerAnswer(cached.value(), cached.confidence(), DecisionLayer.LLM, true, "cached");
        }

        var request = new ReasonerRequest(requestType.name(), contextJson, requestType.allowedValues());
        ReasonerResult result;
        Future<ReasonerResult> future = null;
        try {
            future = executor.submit(() -> reasoner.resolve(request));
            result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Reasoner timed out after {}ms for {}, using {}", timeout.toMillis(), requestType, fallback);
            return ReasonerAnswer.fallback(fallback, "timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Reasoner failed for {}: {}, using {}", requestType, cause.getMessage(), fallback);
            return ReasonerAnswer.fallback(fallback, "provider error: " + cause.getClass().getSimpleName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted waiting for reasoner on {}, using {}", requestType, fallback);
            return ReasonerAnswer.fallback(fallback, "interrupted");
        } catch (RejectedExecutionException e) {
            log.warn("Reasoner pool unavailable for {}, using {}", requestType, fallback);
            return ReasonerAnswer.fallback(fallback, "reasoner unavailable");
        }

        if (result == null || result.decision() == null || result.decision().isBlank()) {
            log.warn("Reasoner returned no decision for {}, using {}", requestType, fallback);
            return ReasonerAnswer.fallback(fallback, "missing decision");
        }
        String value = result.decision().trim().toUpperCase(Locale.ROOT);
        if (!requestType.allows(value)) {
            log.warn("Reasoner returned '{}' which is not allowed for {}, using {}", value, requestType, fallback);
            return ReasonerAnswer.fallback(fallback, "unknown decision");
        }
        Double confidence = result.confidence();
        if (confidence == null || confidence.isNaN() || confidence.isInfinite()) {
            log.warn("Reasoner returned invalid confidence {} for {}, using {}", confidence, requestType, fallback);
            return ReasonerAnswer.fallback(fallback, "invalid confidence");
        }
        double clamped = Math.max(0.0, Math.min(1.0, confidence));

        cache.put(key, new Cached(value, clamped));
        return new ReasonerAnswer(value, clamped, DecisionLayer.LLM, false, "reasoner");
    }

    long cachedEntries() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * Sorted-key JSON of the context without its mission id, so equivalent questions about
     * different missions share a cache entry.
     */
    private String normalise(ObjectNode redacted) throws JsonProcessingException {
        ObjectNode copy = redacted.deepCopy();
        copy.remove("missionId");
        Map<?, ?> asMap = mapper.convertValue(copy, Map.class);
        return canonicalWriter.writeValueAsString(asMap);
    }

    private static String sha256(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record Cached(String value, double confidence) {}

    private static final class ReasonerThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "rex-reasoner-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
