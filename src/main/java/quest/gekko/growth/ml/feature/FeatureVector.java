package quest.gekko.growth.ml.feature;

import lombok.Builder;

/**
 * Fixed-schema feature set for one channel at one point in time.
 * A {@code null} component means there was not enough history to compute it, which is not the same as zero.
 */
@Builder
public record FeatureVector(
        Long subscriberCount,
        Double subscriberGrowthRate30d,
        Double subscriberGrowthRate90d,
        Long viewCount,
        Double viewGrowthRate30d,
        Long videoCount,
        Double uploadFrequency,
        Double avgViewsPerVideo,
        Double engagementRate,
        Integer trendScore,
        Double trendDirection,
        Double trendVolatility,
        Integer newsCount,
        Double newsPositiveRatio,
        Double newsNegativeRatio,
        Long channelAgeDays
) {

    public static FeatureVector empty() {
        return FeatureVector.builder().build();
    }

    public Number get(Feature feature) {
        return feature.valueOf(this);
    }

    /**
     * Values in {@link Feature} order with missing values imputed as 0.
     */
    public double[] toModelInput() {
        Feature[] features = Feature.values();
        double[] row = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            Number value = features[i].valueOf(this);
            row[i] = value == null ? 0.0 : value.doubleValue();
        }
        return row;
    }

    public int presentCount() {
        int present = 0;
        for (Feature feature : Feature.values()) {
            if (feature.valueOf(this) != null) present++;
        }
        return present;
    }

    /** Share of features that could be computed, in [0,1]. */
    public double completeness() {
        return (double) presentCount() / Feature.count();
    }
}
