package com.rekindle.rex.core.resource;

import java.io.Serializable;
import java.time.Instant;

/**
 * A time-bounded grant of one resource to one mission.
 *
 * @param resourceId crew name, domain name or provider name depending on {@code kind}
 * @param holderId   mission id of the holder
 * @param amount     tokens consumed for {@link LeaseKind#API_QUOTA}, 1 otherwise
 */
public record Lease(
    String leaseId,
    LeaseKind kind,
    String resourceId,
    String holderId,
    Instant acquiredAt,
    Instant expiresAt,
    long amount
) implements Serializable {

    /**
     * Key under which a mission holds at most one live lease, e.g. {@code DOMAIN} or {@code API_QUOTA:EMAIL}.
     */
    public String kindKey() {
        return kind == LeaseKind.API_QUOTA ? kindKey(kind, ApiProvider.valueOf(resourceId)) : kind.name();
    }

    public Lease renewedUntil(Instant expiry) {
        return new Lease(leaseId, kind, resourceId, holderId, acquiredAt, expiry, amount);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public static String kindKey(LeaseKind kind, ApiProvider provider) {
        return kind == LeaseKind.API_QUOTA ? kind.name() + ":" + provider.name() : kind.name();
    }
}
