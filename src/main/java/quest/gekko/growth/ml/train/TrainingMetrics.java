package quest.gekko.growth.ml.train;

/**
 * Validation-split quality of a freshly trained model.
 */
public record TrainingMetrics(double rmse, double r2, int boostingRounds, int trainRows, int validationRows) {
}
