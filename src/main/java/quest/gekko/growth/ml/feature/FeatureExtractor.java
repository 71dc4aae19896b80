package quest.gekko.growth.ml.feature;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.growth.domain.ChannelSnapshot;
import quest.gekko.growth.domain.NewsEvent;
import quest.gekko.growth.domain.TrendObservation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Turns a channel's snapshot, news and trend history into a {@link FeatureVector}.
 * <p>
 * Every lookup is bounded by the as-of time, so the same extractor can rebuild the features a channel had at
 * any past moment without reading data recorded after it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureExtractor {

    static final Duration SHORT_WINDOW = Duration.ofDays(30);
    static final Duration LONG_WINDOW = Duration.ofDays(90);

    private final HistoricalDataProvider history;
    private final Clock clock;

    public FeatureVector extract(Long channelId) {
        return extract(channelId, clock.instant());
    }

    public FeatureVector extract(Long channelId, Instant asOf) {
        Instant createdAt = history.channelCreatedAt(channelId)
                .orElseThrow(() -> new ChannelNotFoundException(channelId));

        FeatureVector.FeatureVectorBuilder features = FeatureVector.builder();
        Optional<ChannelSnapshot> latest = history.latestSnapshot(channelId, asOf);

        latest.ifPresent(snapshot -> features
                .subscriberCount(snapshot.getSubscriberCount())
                .viewCount(snapshot.getViewCount())
                .videoCount(snapshot.getVideoCount()));
        latest.ifPresent(snapshot -> growthRates(features, channelId, snapshot, asOf));

        activity(features, history.snapshots(channelId, asOf.minus(SHORT_WINDOW), asOf));
        trend(features, history.trends(channelId, asOf.minus(SHORT_WINDOW), asOf));
        news(features, history.news(channelId, asOf.minus(LONG_WINDOW), asOf));

        features.channelAgeDays(Math.max(0L, Duration.between(createdAt, asOf).toDays()));

        FeatureVector vector = features.build();
        log.debug("Extracted {}/{} features for channel {} as of {}", vector.presentCount(), Feature.count(), channelId, asOf);
        return vector;
    }

    private void growthRates(FeatureVector.FeatureVectorBuilder features, Long channelId, ChannelSnapshot latest, Instant asOf) {
        baseline(channelId, latest, asOf.minus(SHORT_WINDOW)).ifPresent(baseline -> {
            features.subscriberGrowthRate30d(growthRate(latest.getSubscriberCount(), baseline.getSubscriberCount()));
            if (baseline.getSubscriberCount() > 0) {
                features.viewGrowthRate30d(growthRate(latest.getViewCount(), baseline.getViewCount()));
            }
        });
        baseline(channelId, latest, asOf.minus(LONG_WINDOW)).ifPresent(baseline ->
                features.subscriberGrowthRate90d(growthRate(latest.getSubscriberCount(), baseline.getSubscriberCount())));
    }

    /**
     * Latest snapshot at or before the cutoff, unless it is the latest snapshot itself: a single snapshot gives no
     * growth history.
     */
    private Optional<ChannelSnapshot> baseline(Long channelId, ChannelSnapshot latest, Instant cutoff) {
        return history.latestSnapshot(channelId, cutoff)
                .filter(baseline -> baseline != latest && (baseline.getId() == null || !baseline.getId().equals(latest.getId())));
    }

    /**
     * Relative change against a baseline; {@code null} when the baseline is not positive.
     */
    static Double growthRate(long current, long baseline) {
        if (baseline <= 0) return null;
        return (double) (current - baseline) / baseline;
    }

    private void activity(FeatureVector.FeatureVectorBuilder features, List<ChannelSnapshot> window) {
        if (window.size() < 2) return;

        ChannelSnapshot first = window.get(0);
        ChannelSnapshot last = window.get(window.size() - 1);

        long days = Math.max(Duration.between(first.getRecordedAt(), last.getRecordedAt()).toDays(), 1L);
        double videosPerWeek = (double) (last.getVideoCount() - first.getVideoCount()) / days * 7;

        features.uploadFrequency(videosPerWeek)
                .avgViewsPerVideo(last.getVideoCount() > 0 ? (double) last.getViewCount() / last.getVideoCount() : 0.0)
                .engagementRate(last.getSubscriberCount() > 0 ? (double) last.getViewCount() / last.getSubscriberCount() : 0.0);
    }

    private void trend(FeatureVector.FeatureVectorBuilder features, List<TrendObservation> window) {
        if (window.isEmpty()) return;

        int[] scores = window.stream().mapToInt(TrendObservation::getScore).toArray();
        features.trendScore(scores[scores.length - 1])
                .trendDirection(trendDirection(scores))
                .trendVolatility(populationStdDev(scores));
    }

    static double trendDirection(int[] scores) {
        int n = scores.length;
        if (n >= 4) {
            return (scores[n - 1] + scores[n - 2]) / 2.0 - (scores[0] + scores[1]) / 2.0;
        }
        if (n >= 2) {
            return scores[n - 1] - scores[0];
        }
        return 0.0;
    }

    static double populationStdDev(int[] scores) {
        if (scores.length < 2) return 0.0;

        double mean = 0;
        for (int score : scores) mean += score;
        mean /= scores.length;

        double squares = 0;
        for (int score : scores) squares += (score - mean) * (score - mean);
        return Math.sqrt(squares / scores.length);
    }

    private void news(FeatureVector.FeatureVectorBuilder features, List<NewsEvent> window) {
        int count = window.size();
        if (count == 0) {
            features.newsCount(0).newsPositiveRatio(0.0).newsNegativeRatio(0.0);
            return;
        }

        long positive = window.stream().filter(n -> n.getCategory() != null && n.getCategory().isPositive()).count();
        long negative = window.stream().filter(n -> n.getCategory() != null && n.getCategory().isNegative()).count();

        features.newsCount(count)
                .newsPositiveRatio((double) positive / count)
                .newsNegativeRatio((double) negative / count);
    }
}
