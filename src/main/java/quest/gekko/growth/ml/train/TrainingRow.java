package quest.gekko.growth.ml.train;

import quest.gekko.growth.ml.feature.FeatureVector;

import java.util.Map;

/**
 * One labeled example: the features of a channel and the outcome(s) realized afterwards.
 */
public record TrainingRow(Long channelId, FeatureVector features, Map<String, Double> targets) {

    public TrainingRow {
        targets = Map.copyOf(targets);
    }

    public double target(String column) {
        Double value = targets.get(column);
        if (value == null) {
            throw new IllegalArgumentException("Row for channel " + channelId + " has no value for target '" + column + "'");
        }
        return value;
    }
}
