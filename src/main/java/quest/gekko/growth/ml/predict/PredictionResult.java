package quest.gekko.growth.ml.predict;

/**
 * @param predictedGrowthRate expected subscriber growth over the forecast horizon
 * @param confidenceScore     in [0,1]; share of features available, scaled down for rule-based results
 */
public record PredictionResult(double predictedGrowthRate, double confidenceScore, PredictionMode mode) {
}
