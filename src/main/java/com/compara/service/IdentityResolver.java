package com.compara.service;

import com.compara.model.Identity;
import com.compara.model.SubscriptionTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Builds the caller's {@link Identity} from the headers set by the authenticating
 * gateway, the client address and the optional fingerprint and time zone.
 */
@Slf4j
@Component
public class IdentityResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_TIER_HEADER = "X-User-Tier";
    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    static final String UNKNOWN_IP = "unknown";

    public Identity resolve(HttpHeaders headers, InetSocketAddress remoteAddress, String fingerprint, String timezone) {
        String clientIp = clientIp(headers, remoteAddress);
        ZoneId zone = zoneOf(timezone);

        String userId = headers.getFirst(USER_ID_HEADER);
        if (userId != null && !userId.isBlank()) {
            SubscriptionTier tier = SubscriptionTier.fromId(headers.getFirst(USER_TIER_HEADER));
            return Identity.user(userId.trim(), tier, clientIp, zone);
        }
        return Identity.anonymous(clientIp, fingerprint, zone);
    }

    /**
     * First entry of X-Forwarded-For, else the socket's remote address.
     */
    String clientIp(HttpHeaders headers, InetSocketAddress remoteAddress) {
        String forwarded = headers.getFirst(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        if (remoteAddress != null && remoteAddress.getAddress() != null) {
            return remoteAddress.getAddress().getHostAddress();
        }
        return UNKNOWN_IP;
    }

    /**
     * Unknown or invalid zones fall back to UTC.
     */
    public static ZoneId zoneOf(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.debug("Invalid timezone '{}', using UTC", timezone);
            return ZoneOffset.UTC;
        }
    }
}
