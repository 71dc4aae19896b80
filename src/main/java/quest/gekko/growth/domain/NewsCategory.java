package quest.gekko.growth.domain;

/**
 * Category assigned to a news item upstream. Buckets are disjoint: OTHER counts as neither positive nor negative.
 */
public enum NewsCategory {
    COLLABORATION,
    MEDIA,
    CONTROVERSY,
    EVENT,
    OTHER;

    public boolean isPositive() {
        return this == COLLABORATION || this == MEDIA || this == EVENT;
    }

    public boolean isNegative() {
        return this == CONTROVERSY;
    }
}
