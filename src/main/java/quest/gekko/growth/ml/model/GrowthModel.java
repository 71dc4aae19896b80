package quest.gekko.growth.ml.model;

import quest.gekko.growth.ml.feature.Feature;
import smile.data.DataFrame;
import smile.regression.GradientTreeBoost;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A fitted gradient tree boosting regressor over the {@link Feature} columns, plus the metadata stored with it.
 */
public final class GrowthModel {

    public static final String ALGORITHM = "smile-gradient-tree-boost/least-squares";

    private final GradientTreeBoost ensemble;
    private final String targetColumn;
    private final int rounds;
    private final Instant trainedAt;

    public GrowthModel(GradientTreeBoost ensemble, String targetColumn, int rounds, Instant trainedAt) {
        this.ensemble = ensemble;
        this.targetColumn = targetColumn;
        this.rounds = rounds;
        this.trainedAt = trainedAt;
    }

    /**
     * @param features one value per {@link Feature}, in declaration order
     */
    public double predict(double[] features) {
        return predict(new double[][] { features })[0];
    }

    public double[] predict(double[][] features) {
        DataFrame frame = frame(features, new double[features.length], targetColumn);
        double[] out = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            out[i] = ensemble.predict(frame.get(i));
        }
        return out;
    }

    /** Impurity reduction accumulated per feature over all trees, in {@link Feature} order. */
    public double[] importance() {
        return ensemble.importance().clone();
    }

    public GradientTreeBoost ensemble() {
        return ensemble;
    }

    public String targetColumn() {
        return targetColumn;
    }

    public int rounds() {
        return rounds;
    }

    public Instant trainedAt() {
        return trainedAt;
    }

    /**
     * Builds the frame layout the ensemble is trained on: the feature columns followed by the target column.
     */
    public static DataFrame frame(double[][] features, double[] target, String targetColumn) {
        double[][] data = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            data[i] = Arrays.copyOf(features[i], Feature.count() + 1);
            data[i][Feature.count()] = target[i];
        }
        List<String> columns = new ArrayList<>(Feature.names());
        columns.add(targetColumn);
        return DataFrame.of(data, columns.toArray(String[]::new));
    }
}
