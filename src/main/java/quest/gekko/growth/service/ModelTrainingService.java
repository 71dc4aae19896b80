package quest.gekko.growth.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.growth.config.GrowthProperties;
import quest.gekko.growth.ml.predict.GrowthPredictor;
import quest.gekko.growth.ml.train.InsufficientTrainingDataException;
import quest.gekko.growth.ml.train.TrainingDataBuilder;
import quest.gekko.growth.ml.train.TrainingDataset;
import quest.gekko.growth.ml.train.TrainingMetrics;

import java.time.Clock;
import java.util.Comparator;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ModelTrainingService {

    private final TrainingDataBuilder trainingDataBuilder;
    private final GrowthPredictor predictor;
    private final GrowthProperties.Training settings;
    private final Clock clock;

    /**
     * Builds labeled rows from the collected history and trains a new model on them.
     *
     * @throws InsufficientTrainingDataException when fewer than {@code growth.training.min-rows} channels have enough
     *                                           history; nothing is fitted or written in that case
     */
    public TrainingMetrics trainFromHistory() {
        return train(trainingDataBuilder.build(clock.instant()));
    }

    public TrainingMetrics train(TrainingDataset dataset) {
        if (dataset.size() < settings.minRows()) {
            throw new InsufficientTrainingDataException(dataset.size(), settings.minRows());
        }

        log.info("Training on {} rows, target '{}'", dataset.size(), settings.targetColumn());
        TrainingMetrics metrics = predictor.train(dataset, settings.targetColumn());

        Map<String, Double> importance = predictor.getFeatureImportance();
        double max = importance.values().stream().mapToDouble(Double::doubleValue).max().orElse(0);
        importance.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()))
                .forEach(e -> log.info("  {} {} ({})", String.format("%-24s", e.getKey()),
                        "=".repeat(max > 0 ? (int) (e.getValue() / max * 30) : 0), Math.round(e.getValue())));
        return metrics;
    }
}
