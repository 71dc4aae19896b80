package quest.gekko.growth.web.dto;

import quest.gekko.growth.domain.Prediction;
import quest.gekko.growth.ml.predict.PredictionMode;

import java.time.Instant;

public record PredictionDTO(
        Long channelId,
        double predictedGrowthRate,
        double confidenceScore,
        PredictionMode mode,

        // Features the prediction was made from - nullable
        Double featureSubscriberGrowthRate,
        Double featureViewGrowthRate,
        Double featureUploadFrequency,
        Double featureEngagementRate,
        Integer featureTrendScore,
        Integer featureNewsCount,
        Double featureNewsPositiveRatio,
        Instant createdAt
) {

    public static PredictionDTO of(Long channelId, Prediction p) {
        return new PredictionDTO(channelId, p.getPredictedGrowthRate(), p.getConfidenceScore(), p.getMode(),
                p.getFeatureSubscriberGrowthRate(), p.getFeatureViewGrowthRate(), p.getFeatureUploadFrequency(),
                p.getFeatureEngagementRate(), p.getFeatureTrendScore(), p.getFeatureNewsCount(),
                p.getFeatureNewsPositiveRatio(), p.getCreatedAt());
    }
}
