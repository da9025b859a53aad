package com.compara.model;

import java.util.Locale;

/**
 * Subscription tiers with their credit allocation, model limit and stored-conversation limit.
 *
 * 1 credit = 1,000 effective tokens; effective tokens = input + (output x 2.5).
 */
public enum SubscriptionTier {

    UNREGISTERED("unregistered", PeriodKind.DAILY, 50, 3, 2),
    FREE("free", PeriodKind.DAILY, 100, 3, 3),
    STARTER("starter", PeriodKind.MONTHLY, 1_200, 6, 10),
    STARTER_PLUS("starter_plus", PeriodKind.MONTHLY, 2_500, 6, 20),
    PRO("pro", PeriodKind.MONTHLY, 5_000, 9, 40),
    PRO_PLUS("pro_plus", PeriodKind.MONTHLY, 10_000, 12, 80);

    private final String id;
    private final PeriodKind periodKind;
    private final long creditAllocation;
    private final int modelLimit;
    private final int conversationLimit;

    SubscriptionTier(String id, PeriodKind periodKind, long creditAllocation, int modelLimit, int conversationLimit) {
        this.id = id;
        this.periodKind = periodKind;
        this.creditAllocation = creditAllocation;
        this.modelLimit = modelLimit;
        this.conversationLimit = conversationLimit;
    }

    public String getId() {
        return id;
    }

    public PeriodKind getPeriodKind() {
        return periodKind;
    }

    public long getCreditAllocation() {
        return creditAllocation;
    }

    public int getModelLimit() {
        return modelLimit;
    }

    public int getConversationLimit() {
        return conversationLimit;
    }

    /**
     * Resolve a tier from its identifier. Unknown or missing values for an
     * authenticated user fall back to {@link #FREE}.
     */
    public static SubscriptionTier fromId(String value) {
        if (value == null || value.isBlank()) {
            return FREE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("anonymous".equals(normalized)) {
            return UNREGISTERED;
        }
        for (SubscriptionTier tier : values()) {
            if (tier.id.equals(normalized)) {
                return tier;
            }
        }
        return FREE;
    }
}
