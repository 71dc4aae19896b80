package quest.gekko.growth.ml.predict;

import lombok.extern.slf4j.Slf4j;
import quest.gekko.growth.ml.feature.Feature;
import quest.gekko.growth.ml.feature.FeatureVector;
import quest.gekko.growth.ml.model.GrowthModel;
import quest.gekko.growth.ml.model.ModelStore;
import quest.gekko.growth.ml.train.GradientBoostingTrainer;
import quest.gekko.growth.ml.train.TrainingDataset;
import quest.gekko.growth.ml.train.TrainingMetrics;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Predicts subscriber growth from a {@link FeatureVector}.
 * <p>
 * Uses the trained model when an artifact could be loaded, otherwise a deterministic rule-based estimate. Apart from
 * the current model reference the predictor keeps no state between calls.
 */
@Slf4j
public class GrowthPredictor {

    static final double RULE_BASED_CONFIDENCE_FACTOR = 0.7;

    private final ModelStore store;
    private final GradientBoostingTrainer trainer;
    private volatile GrowthModel model;

    public GrowthPredictor(ModelStore store, GradientBoostingTrainer trainer) {
        this.store = store;
        this.trainer = trainer;
        this.model = loadQuietly(store);
    }

    private static GrowthModel loadQuietly(ModelStore store) {
        try {
            Optional<GrowthModel> loaded = store.load();
            if (loaded.isEmpty()) {
                log.info("No model artifact at {}, using rule-based predictions", store.path());
                return null;
            }
            log.info("Loaded model artifact from {} (trained {}, {} rounds)", store.path(), loaded.get().trainedAt(), loaded.get().rounds());
            return loaded.get();
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unreadable model artifact at {}, using rule-based predictions: {}", store.path(), e.getMessage());
            return null;
        }
    }

    public boolean isLoaded() {
        return model != null;
    }

    public Optional<Instant> trainedAt() {
        GrowthModel current = model;
        return current == null ? Optional.empty() : Optional.of(current.trainedAt());
    }

    public PredictionResult predict(FeatureVector features) {
        GrowthModel current = model;
        if (current == null) {
            return ruleBased(features);
        }
        double growth = current.predict(features.toModelInput());
        return new PredictionResult(growth, features.completeness(), PredictionMode.MODEL);
    }

    /**
     * Blends the monthly growth of the last 30 and 90 days into a six-month estimate and adjusts it for search
     * interest, news volume and upload cadence.
     */
    PredictionResult ruleBased(FeatureVector features) {
        double growth30 = orZero(features.subscriberGrowthRate30d());
        double growth90 = orZero(features.subscriberGrowthRate90d());

        double base = (growth30 + growth90 / 3) / 2 * 6;
        double trendFactor = ((features.trendScore() == null ? 50 : features.trendScore()) - 50) / 100.0;
        double newsFactor = Math.min(orZero(features.newsCount()) * 0.01, 0.10);
        double uploadFactor = Math.min(orZero(features.uploadFrequency()) * 0.5, 0.10);

        double growth = base * (1 + trendFactor) + newsFactor + uploadFactor;
        return new PredictionResult(growth, features.completeness() * RULE_BASED_CONFIDENCE_FACTOR, PredictionMode.RULE_BASED);
    }

    private static double orZero(Number value) {
        return value == null ? 0.0 : value.doubleValue();
    }

    /**
     * Fits a new model, persists it as the current artifact and switches predictions over to it.
     * The previous model stays in use if fitting or saving fails.
     */
    public TrainingMetrics train(TrainingDataset dataset, String targetColumn) {
        GradientBoostingTrainer.Result result = trainer.fit(dataset, targetColumn);
        try {
            store.save(result.model());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not save model artifact to " + store.path(), e);
        }
        model = result.model();
        return result.metrics();
    }

    /**
     * Gain-based importance keyed by feature name in model column order; empty without a trained model.
     */
    public Map<String, Double> getFeatureImportance() {
        GrowthModel current = model;
        if (current == null) return Collections.emptyMap();

        double[] importance = current.importance();
        List<String> names = Feature.names();
        Map<String, Double> byName = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            byName.put(names.get(i), i < importance.length ? importance[i] : 0.0);
        }
        return byName;
    }
}
