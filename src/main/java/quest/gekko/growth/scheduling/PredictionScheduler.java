package quest.gekko.growth.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.growth.job.JobAlreadyRunningException;
import quest.gekko.growth.job.JobCoordinator;
import quest.gekko.growth.job.JobType;
import quest.gekko.growth.service.PredictionService;

@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionScheduler {
    private final JobCoordinator jobCoordinator;
    private final PredictionService predictionService;

    // 03:30 UTC daily, after the collectors have written the day's snapshots
    @Scheduled(cron = "${growth.prediction.cron:0 30 3 * * *}", zone = "UTC")
    public void runDailyPrediction() {
        try {
            jobCoordinator.run(JobType.PREDICT, "Scheduled prediction",
                    () -> "Predicted " + predictionService.predictAll() + " channels");
        } catch (JobAlreadyRunningException e) {
            log.warn("Skipping scheduled prediction: {}", e.getMessage());
        }
    }
}
