package com.rekindle.rex.core.resource;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One {@link TokenBucket} per {@link ApiProvider}. Consumed tokens are never refunded.
 */
final class ApiQuotaPool {

    private final Map<ApiProvider, TokenBucket> buckets = new EnumMap<>(ApiProvider.class);

    ApiQuotaPool(Map<ApiProvider, ResourceProperties.ProviderQuota> quotas, Clock clock) {
        for (ApiProvider provider : ApiProvider.values()) {
            ResourceProperties.ProviderQuota quota = quotas.get(provider);
            if (quota == null) {
                throw new IllegalArgumentException("No quota configured for provider " + provider);
            }
            buckets.put(provider, new TokenBucket(quota.getCapacity(), quota.getRefillAmount(),
                    quota.getRefillPeriod(), clock));
        }
    }

    synchronized boolean tryConsume(ApiProvider provider, long amount) {
        return buckets.get(provider).tryConsume(amount);
    }

    synchronized long available(ApiProvider provider) {
        return buckets.get(provider).available();
    }

    synchronized Map<String, Double> utilization() {
        var result = new LinkedHashMap<String, Double>();
        buckets.forEach((provider, bucket) -> result.put(provider.name(), bucket.utilization()));
        return result;
    }

    synchronized Map<String, ResourceSnapshot.QuotaState> states() {
        var result = new LinkedHashMap<String, ResourceSnapshot.QuotaState>();
        buckets.forEach((provider, bucket) -> result.put(provider.name(),
                new ResourceSnapshot.QuotaState(provider.serviceName(), bucket.capacity(), bucket.available(),
                        bucket.utilization())));
        return result;
    }
}
