package quest.gekko.growth.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import quest.gekko.growth.job.JobCoordinator;
import quest.gekko.growth.job.JobStatus;
import quest.gekko.growth.job.JobType;
import quest.gekko.growth.ml.predict.GrowthPredictor;
import quest.gekko.growth.ml.train.TrainingMetrics;
import quest.gekko.growth.service.ModelTrainingService;
import quest.gekko.growth.service.PredictionService;
import quest.gekko.growth.web.dto.ModelInfoDTO;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private final JobCoordinator jobCoordinator;
    private final PredictionService predictionService;
    private final ModelTrainingService trainingService;
    private final GrowthPredictor predictor;

    @GetMapping("/status")
    public JobStatus status() {
        return jobCoordinator.status();
    }

    // Predict and store growth for all channels
    @PostMapping("/predict")
    public JobStatus predict() {
        return jobCoordinator.run(JobType.PREDICT, "Prediction started",
                () -> "Predicted " + predictionService.predictAll() + " channels");
    }

    // Retrain the model from collected history
    @PostMapping("/train")
    public JobStatus train() {
        return jobCoordinator.run(JobType.TRAIN, "Training started", () -> {
            TrainingMetrics metrics = trainingService.trainFromHistory();
            return String.format("Training finished: RMSE %.4f, R2 %.4f, %d rounds on %d rows",
                    metrics.rmse(), metrics.r2(), metrics.boostingRounds(), metrics.trainRows() + metrics.validationRows());
        });
    }

    @GetMapping("/model")
    public ModelInfoDTO model() {
        return new ModelInfoDTO(predictor.isLoaded(), predictor.trainedAt().orElse(null), predictor.getFeatureImportance());
    }
}
