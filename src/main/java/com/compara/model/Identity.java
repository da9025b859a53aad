package com.compara.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZoneId;

/**
 * Who is asking: an authenticated user, or an anonymous caller known only by
 * client IP and an optional browser fingerprint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Identity {

    /**
     * Authenticated user id, null for anonymous callers.
     */
    private String userId;

    private SubscriptionTier tier;

    private String clientIp;

    private String fingerprint;

    private ZoneId zone;

    public boolean isAnonymous() {
        return userId == null;
    }

    public boolean hasFingerprint() {
        return fingerprint != null && !fingerprint.isBlank();
    }

    public static Identity user(String userId, SubscriptionTier tier, String clientIp, ZoneId zone) {
        return Identity.builder()
                .userId(userId)
                .tier(tier)
                .clientIp(clientIp)
                .zone(zone)
                .build();
    }

    public static Identity anonymous(String clientIp, String fingerprint, ZoneId zone) {
        return Identity.builder()
                .tier(SubscriptionTier.UNREGISTERED)
                .clientIp(clientIp)
                .fingerprint(fingerprint)
                .zone(zone)
                .build();
    }
}
