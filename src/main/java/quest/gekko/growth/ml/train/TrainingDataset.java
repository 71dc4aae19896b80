package quest.gekko.growth.ml.train;

import quest.gekko.growth.ml.feature.Feature;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Table of labeled rows; columns are the model features followed by the target columns.
 */
public record TrainingDataset(List<TrainingRow> rows) {

    public TrainingDataset {
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Set<String> targetColumns() {
        Set<String> targets = new LinkedHashSet<>();
        rows.forEach(row -> targets.addAll(row.targets().keySet()));
        return targets;
    }

    public List<String> columns() {
        List<String> columns = new ArrayList<>(Feature.names());
        columns.addAll(targetColumns());
        return columns;
    }

    /** Feature matrix in model column order, missing values imputed as 0. */
    public double[][] featureMatrix() {
        return rows.stream().map(row -> row.features().toModelInput()).toArray(double[][]::new);
    }

    public double[] targetVector(String column) {
        return rows.stream().mapToDouble(row -> row.target(column)).toArray();
    }
}
