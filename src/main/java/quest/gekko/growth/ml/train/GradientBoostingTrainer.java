package quest.gekko.growth.ml.train;

import lombok.extern.slf4j.Slf4j;
import quest.gekko.growth.config.GrowthProperties;
import quest.gekko.growth.ml.model.GrowthModel;
import smile.base.cart.Loss;
import smile.data.DataFrame;
import smile.data.formula.Formula;
import smile.math.MathEx;
import smile.regression.GradientTreeBoost;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Fits a least-squares gradient tree boosting model with a seeded train/validation split and early stopping on
 * validation RMSE.
 */
@Slf4j
public class GradientBoostingTrainer {

    private final GrowthProperties.Training settings;
    private final Clock clock;

    public GradientBoostingTrainer(GrowthProperties.Training settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public record Result(GrowthModel model, TrainingMetrics metrics) {}

    public Result fit(TrainingDataset dataset, String targetColumn) {
        if (!dataset.targetColumns().contains(targetColumn)) {
            throw new IllegalArgumentException("Dataset has no target column '" + targetColumn + "', columns are " + dataset.columns());
        }
        if (dataset.size() < 2) {
            throw new IllegalArgumentException("At least 2 rows are needed to split into train and validation sets");
        }

        double[][] x = dataset.featureMatrix();
        double[] y = dataset.targetVector(targetColumn);

        Split split = split(dataset.size());
        DataFrame train = GrowthModel.frame(select(x, split.train()), select(y, split.train()), targetColumn);
        double[][] validationX = select(x, split.validation());
        double[] validationY = select(y, split.validation());
        DataFrame validation = GrowthModel.frame(validationX, validationY, targetColumn);

        GradientTreeBoost ensemble = boost(train, targetColumn, settings.maxRounds());
        int rounds = bestRounds(ensemble.test(validation), validationY);
        if (rounds < ensemble.size()) {
            // same seed, so the first trees are identical to the ones scored above
            ensemble = boost(train, targetColumn, rounds);
        }

        GrowthModel model = new GrowthModel(ensemble, targetColumn, rounds, clock.instant());
        double[] predicted = model.predict(validationX);
        TrainingMetrics metrics = new TrainingMetrics(rmse(validationY, predicted), r2(validationY, predicted),
                rounds, split.train().size(), split.validation().size());

        log.info("Validation RMSE: {}, R2: {} after {} rounds ({} train / {} validation rows)",
                String.format("%.4f", metrics.rmse()), String.format("%.4f", metrics.r2()),
                rounds, metrics.trainRows(), metrics.validationRows());
        return new Result(model, metrics);
    }

    private GradientTreeBoost boost(DataFrame train, String targetColumn, int rounds) {
        MathEx.setSeed(settings.seed());
        return GradientTreeBoost.fit(Formula.lhs(targetColumn), train, Loss.ls(), rounds,
                settings.maxDepth(), settings.maxNodes(), settings.nodeSize(), settings.learningRate(), settings.subsample());
    }

    /**
     * Scans the per-round validation predictions and stops once {@code earlyStoppingRounds} rounds in a row failed to
     * improve the best RMSE.
     *
     * @param staged staged[k][i] is the prediction for validation row i using the first k+1 trees
     * @return number of trees of the best round
     */
    int bestRounds(double[][] staged, double[] actual) {
        int best = 0;
        double bestRmse = Double.POSITIVE_INFINITY;
        for (int k = 0; k < staged.length; k++) {
            double rmse = rmse(actual, staged[k]);
            if (rmse < bestRmse) {
                bestRmse = rmse;
                best = k;
            } else if (k - best >= settings.earlyStoppingRounds()) {
                log.debug("Early stopping at round {}, best round {} (RMSE {})", k + 1, best + 1, bestRmse);
                break;
            }
        }
        return best + 1;
    }

    record Split(List<Integer> train, List<Integer> validation) {}

    /**
     * Shuffles row indices with the configured seed and holds out {@code validationFraction} of them (at least one).
     */
    Split split(int rows) {
        List<Integer> indices = new ArrayList<>(IntStream.range(0, rows).boxed().toList());
        Collections.shuffle(indices, new Random(settings.seed()));

        int validation = (int) Math.ceil(rows * settings.validationFraction());
        validation = Math.min(Math.max(validation, 1), rows - 1);
        return new Split(List.copyOf(indices.subList(validation, rows)), List.copyOf(indices.subList(0, validation)));
    }

    static double rmse(double[] actual, double[] predicted) {
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            double diff = actual[i] - predicted[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum / actual.length);
    }

    static double r2(double[] actual, double[] predicted) {
        double mean = 0;
        for (double v : actual) mean += v;
        mean /= actual.length;

        double residual = 0;
        double total = 0;
        for (int i = 0; i < actual.length; i++) {
            residual += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
            total += (actual[i] - mean) * (actual[i] - mean);
        }
        if (total == 0) {
            return residual == 0 ? 1.0 : 0.0;
        }
        return 1 - residual / total;
    }

    private static double[][] select(double[][] rows, List<Integer> indices) {
        return indices.stream().map(i -> rows[i]).toArray(double[][]::new);
    }

    private static double[] select(double[] values, List<Integer> indices) {
        return indices.stream().mapToDouble(i -> values[i]).toArray();
    }
}
