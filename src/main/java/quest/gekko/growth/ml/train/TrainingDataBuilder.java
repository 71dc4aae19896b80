package quest.gekko.growth.ml.train;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.growth.config.GrowthProperties;
import quest.gekko.growth.domain.ChannelSnapshot;
import quest.gekko.growth.ml.feature.FeatureExtractor;
import quest.gekko.growth.ml.feature.FeatureVector;
import quest.gekko.growth.ml.feature.HistoricalDataProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Labels each channel with the subscriber growth it actually achieved over the training horizon.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingDataBuilder {

    private final HistoricalDataProvider history;
    private final FeatureExtractor featureExtractor;
    private final GrowthProperties.Training settings;

    public TrainingDataset build(Instant now) {
        Instant horizonStart = now.minus(Duration.ofDays(settings.horizonDays()));
        Instant featuresAsOf = settings.featureAnchor() == FeatureAnchor.BASELINE ? horizonStart : now;

        List<Long> channelIds = history.channelIds();
        List<TrainingRow> rows = new ArrayList<>();
        int skipped = 0;

        for (Long channelId : channelIds) {
            try {
                Optional<TrainingRow> row = label(channelId, horizonStart, now, featuresAsOf);
                if (row.isPresent()) {
                    rows.add(row.get());
                } else {
                    skipped++;
                }
            } catch (Exception e) {
                skipped++;
                log.warn("Skipping channel {} while building training data: {}", channelId, e.getMessage());
            }
        }

        log.info("Built {} training rows from {} channels ({} skipped, features as of {})",
                rows.size(), channelIds.size(), skipped, settings.featureAnchor());
        return new TrainingDataset(rows);
    }

    private Optional<TrainingRow> label(Long channelId, Instant horizonStart, Instant now, Instant featuresAsOf) {
        Optional<ChannelSnapshot> baseline = history.latestSnapshot(channelId, horizonStart);
        Optional<ChannelSnapshot> current = history.latestSnapshot(channelId, now);
        if (baseline.isEmpty() || current.isEmpty() || baseline.get().getSubscriberCount() <= 0) {
            return Optional.empty();
        }

        long before = baseline.get().getSubscriberCount();
        double actualGrowth = (double) (current.get().getSubscriberCount() - before) / before * 100;

        FeatureVector features = featureExtractor.extract(channelId, featuresAsOf);
        return Optional.of(new TrainingRow(channelId, features, Map.of(settings.targetColumn(), actualGrowth)));
    }
}
