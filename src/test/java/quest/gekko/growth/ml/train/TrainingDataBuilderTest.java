package quest.gekko.growth.ml.train;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import quest.gekko.growth.config.GrowthProperties;
import quest.gekko.growth.ml.feature.FeatureExtractor;
import quest.gekko.growth.ml.feature.InMemoryHistoricalDataProvider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TrainingDataBuilderTest {

    private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

    private InMemoryHistoricalDataProvider history;
    private FeatureExtractor extractor;

    @BeforeEach
    void setUp() {
        history = new InMemoryHistoricalDataProvider();
        extractor = new FeatureExtractor(history, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Instant daysAgo(long days) {
        return NOW.minus(Duration.ofDays(days));
    }

    private TrainingDataBuilder builder(FeatureAnchor anchor) {
        GrowthProperties.Training defaults = GrowthProperties.Training.defaults();
        GrowthProperties.Training settings = new GrowthProperties.Training(defaults.minRows(), defaults.horizonDays(),
                defaults.targetColumn(), anchor, defaults.learningRate(), defaults.maxRounds(),
                defaults.earlyStoppingRounds(), defaults.validationFraction(), defaults.seed(), defaults.subsample(),
                defaults.maxDepth(), defaults.maxNodes(), defaults.nodeSize());
        return new TrainingDataBuilder(history, extractor, settings);
    }

    @Test
    void build_shouldLabelGrowthPercentOverHorizon() {
        history.channel(1L, daysAgo(1000));
        history.snapshot(1L, daysAgo(200), 1000, 10_000, 20)
                .snapshot(1L, daysAgo(181), 1100, 11_000, 21)
                .snapshot(1L, daysAgo(2), 1650, 20_000, 30);

        TrainingDataset dataset = builder(FeatureAnchor.CURRENT).build(NOW);

        assertEquals(1, dataset.size());
        TrainingRow row = dataset.rows().get(0);
        assertEquals(1L, row.channelId());
        assertEquals(50.0, row.target("actualGrowthRate"), 1e-9);
        assertEquals(1650L, row.features().subscriberCount());
    }

    @Test
    void build_shouldSkipChannelsWithoutUsableBaseline() {
        history.channel(1L, daysAgo(100));
        history.snapshot(1L, daysAgo(50), 500, 1000, 3)
                .snapshot(1L, NOW, 900, 2000, 5);
        history.channel(2L, daysAgo(1000));
        history.snapshot(2L, daysAgo(300), 0, 0, 0)
                .snapshot(2L, NOW, 400, 900, 4);
        history.channel(3L, daysAgo(1000));
        history.snapshot(3L, daysAgo(190), 200, 1000, 4)
                .snapshot(3L, NOW, 150, 1500, 6);

        TrainingDataset dataset = builder(FeatureAnchor.CURRENT).build(NOW);

        assertEquals(1, dataset.size());
        assertEquals(3L, dataset.rows().get(0).channelId());
        assertEquals(-25.0, dataset.rows().get(0).target("actualGrowthRate"), 1e-9);
    }

    @Test
    void build_shouldExtractFeaturesAtHorizonStartWithBaselineAnchor() {
        history.channel(1L, daysAgo(1000));
        history.snapshot(1L, daysAgo(185), 1000, 10_000, 20)
                .snapshot(1L, NOW, 3000, 40_000, 60);

        TrainingRow row = builder(FeatureAnchor.BASELINE).build(NOW).rows().get(0);

        assertEquals(1000L, row.features().subscriberCount());
        assertEquals(820L, row.features().channelAgeDays());
        assertEquals(200.0, row.target("actualGrowthRate"), 1e-9);
    }

    @Test
    void build_shouldReturnEmptyDatasetWithoutChannels() {
        assertTrue(builder(FeatureAnchor.CURRENT).build(NOW).isEmpty());
    }
}
