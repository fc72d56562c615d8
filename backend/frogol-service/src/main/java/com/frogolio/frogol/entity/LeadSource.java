package com.frogolio.frogol.entity;

/**
 * Known lead sources with the score assigned to leads coming from them
 */
public enum LeadSource {
    DIRECT("direct", 100),
    REFERRAL("referral", 90),
    SOCIAL("social", 80);

    public static final int DEFAULT_SCORE = 70;

    private final String value;
    private final int score;

    LeadSource(String value, int score) {
        this.value = value;
        this.score = score;
    }

    public String getValue() {
        return value;
    }

    public int getScore() {
        return score;
    }

    /**
     * Score for a raw source value; exact match, anything unknown or null scores {@link #DEFAULT_SCORE}
     */
    public static int scoreFor(String source) {
        if (source == null)
            return DEFAULT_SCORE;
        for (LeadSource candidate : values()) {
            if (candidate.value.equals(source))
                return candidate.score;
        }
        return DEFAULT_SCORE;
    }
}
