package com.compara.credit;

import com.compara.model.Identity;
import com.compara.model.PeriodKind;
import com.compara.model.SubscriptionTier;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.apache.commons.codec.digest.DigestUtils;

import java.time.ZoneId;
import java.util.List;

/**
 * One independently metered ledger bucket. Authenticated users own a single
 * bucket; anonymous callers are metered by IP and, when supplied, by fingerprint.
 */
@Data
@AllArgsConstructor
public class CreditBucket {

    private static final String USER_PREFIX = "user:";
    private static final String IP_PREFIX = "ip:";
    private static final String FINGERPRINT_PREFIX = "fp:";

    private String key;
    private SubscriptionTier tier;
    private ZoneId zone;

    public PeriodKind getPeriodKind() {
        return tier.getPeriodKind();
    }

    public long getAllocation() {
        return tier.getCreditAllocation();
    }

    public static CreditBucket forUser(String userId, SubscriptionTier tier, ZoneId zone) {
        return new CreditBucket(USER_PREFIX + userId, tier, zone);
    }

    public static CreditBucket forIp(String clientIp, ZoneId zone) {
        return new CreditBucket(IP_PREFIX + clientIp, SubscriptionTier.UNREGISTERED, zone);
    }

    /**
     * Fingerprints are stored hashed; the raw value can be arbitrarily long.
     */
    public static CreditBucket forFingerprint(String fingerprint, ZoneId zone) {
        return new CreditBucket(FINGERPRINT_PREFIX + DigestUtils.sha256Hex(fingerprint),
                SubscriptionTier.UNREGISTERED, zone);
    }

    /**
     * All buckets that meter the given identity, in a stable order.
     */
    public static List<CreditBucket> forIdentity(Identity identity) {
        ZoneId zone = identity.getZone() != null ? identity.getZone() : ZoneId.of("UTC");
        if (!identity.isAnonymous()) {
            return List.of(forUser(identity.getUserId(), identity.getTier(), zone));
        }
        if (identity.hasFingerprint()) {
            return List.of(forIp(identity.getClientIp(), zone), forFingerprint(identity.getFingerprint(), zone));
        }
        return List.of(forIp(identity.getClientIp(), zone));
    }
}
