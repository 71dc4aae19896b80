package quest.gekko.growth.ml.feature;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * The closed set of model features. Declaration order is the column order of the trained model input.
 */
public enum Feature {
    SUBSCRIBER_COUNT("subscriberCount", FeatureVector::subscriberCount),
    SUBSCRIBER_GROWTH_RATE_30D("subscriberGrowthRate30d", FeatureVector::subscriberGrowthRate30d),
    SUBSCRIBER_GROWTH_RATE_90D("subscriberGrowthRate90d", FeatureVector::subscriberGrowthRate90d),
    VIEW_COUNT("viewCount", FeatureVector::viewCount),
    VIEW_GROWTH_RATE_30D("viewGrowthRate30d", FeatureVector::viewGrowthRate30d),
    VIDEO_COUNT("videoCount", FeatureVector::videoCount),
    UPLOAD_FREQUENCY("uploadFrequency", FeatureVector::uploadFrequency),
    AVG_VIEWS_PER_VIDEO("avgViewsPerVideo", FeatureVector::avgViewsPerVideo),
    ENGAGEMENT_RATE("engagementRate", FeatureVector::engagementRate),
    TREND_SCORE("trendScore", FeatureVector::trendScore),
    TREND_DIRECTION("trendDirection", FeatureVector::trendDirection),
    TREND_VOLATILITY("trendVolatility", FeatureVector::trendVolatility),
    NEWS_COUNT("newsCount", FeatureVector::newsCount),
    NEWS_POSITIVE_RATIO("newsPositiveRatio", FeatureVector::newsPositiveRatio),
    NEWS_NEGATIVE_RATIO("newsNegativeRatio", FeatureVector::newsNegativeRatio),
    CHANNEL_AGE_DAYS("channelAgeDays", FeatureVector::channelAgeDays);

    private static final List<String> NAMES = Arrays.stream(values()).map(Feature::key).toList();

    private final String key;
    private final Function<FeatureVector, Number> accessor;

    Feature(String key, Function<FeatureVector, Number> accessor) {
        this.key = key;
        this.accessor = accessor;
    }

    public String key() {
        return key;
    }

    Number valueOf(FeatureVector vector) {
        return accessor.apply(vector);
    }

    /** Feature names in model column order. */
    public static List<String> names() {
        return NAMES;
    }

    public static int count() {
        return NAMES.size();
    }
}
