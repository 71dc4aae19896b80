package quest.gekko.growth.ml.feature;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import quest.gekko.growth.domain.Channel;
import quest.gekko.growth.domain.ChannelSnapshot;
import quest.gekko.growth.domain.NewsCategory;
import quest.gekko.growth.domain.NewsEvent;
import quest.gekko.growth.domain.TrendObservation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(JpaHistoricalDataProvider.class)
class JpaHistoricalDataProviderTest {

    private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private JpaHistoricalDataProvider provider;

    private Channel channel;
    private Channel other;

    @BeforeEach
    void setUp() {
        channel = persistChannel("UCgrowth", NOW.minus(Duration.ofDays(400)));
        other = persistChannel("UCother", NOW.minus(Duration.ofDays(10)));
    }

    private Channel persistChannel(String platformId, Instant createdAt) {
        Channel c = new Channel();
        c.setPlatformId(platformId);
        c.setTitle(platformId);
        c.setCreatedAt(createdAt);
        return entityManager.persist(c);
    }

    private void snapshot(Channel owner, long daysAgo, long subscribers) {
        ChannelSnapshot s = new ChannelSnapshot();
        s.setChannel(owner);
        s.setRecordedAt(NOW.minus(Duration.ofDays(daysAgo)));
        s.setSubscriberCount(subscribers);
        s.setViewCount(subscribers * 10);
        s.setVideoCount(5);
        entityManager.persist(s);
    }

    @Test
    void latestSnapshot_shouldIncludeCutoffAndIgnoreLaterData() {
        snapshot(channel, 60, 100);
        snapshot(channel, 30, 200);
        snapshot(channel, 0, 300);
        snapshot(other, 30, 9999);
        entityManager.flush();

        ChannelSnapshot latest = provider.latestSnapshot(channel.getId(), NOW.minus(Duration.ofDays(30))).orElseThrow();

        assertEquals(200, latest.getSubscriberCount());
        assertTrue(provider.latestSnapshot(channel.getId(), NOW.minus(Duration.ofDays(61))).isEmpty());
    }

    @Test
    void snapshots_shouldReturnInclusiveWindowInTimeOrder() {
        snapshot(channel, 0, 300);
        snapshot(channel, 30, 200);
        snapshot(channel, 31, 150);
        snapshot(channel, 15, 250);
        entityManager.flush();

        List<ChannelSnapshot> window = provider.snapshots(channel.getId(), NOW.minus(Duration.ofDays(30)), NOW);

        assertEquals(List.of(200L, 250L, 300L), window.stream().map(ChannelSnapshot::getSubscriberCount).toList());
    }

    @Test
    void newsAndTrends_shouldBeScopedToChannelAndWindow() {
        NewsEvent inside = new NewsEvent();
        inside.setChannel(channel);
        inside.setTitle("Collab announced");
        inside.setCategory(NewsCategory.COLLABORATION);
        inside.setPublishedAt(NOW.minus(Duration.ofDays(5)));
        entityManager.persist(inside);

        NewsEvent undated = new NewsEvent();
        undated.setChannel(channel);
        undated.setTitle("Undated mention");
        entityManager.persist(undated);

        TrendObservation trend = new TrendObservation();
        trend.setChannel(channel);
        trend.setScore(55);
        trend.setRecordedAt(NOW.minus(Duration.ofDays(2)));
        entityManager.persist(trend);
        entityManager.flush();

        Instant from = NOW.minus(Duration.ofDays(90));
        assertEquals(1, provider.news(channel.getId(), from, NOW).size());
        assertEquals(NewsCategory.COLLABORATION, provider.news(channel.getId(), from, NOW).get(0).getCategory());
        assertTrue(provider.news(other.getId(), from, NOW).isEmpty());
        assertEquals(55, provider.trends(channel.getId(), from, NOW).get(0).getScore());
    }

    @Test
    void channels_shouldExposeIdsAndCreationTime() {
        assertEquals(List.of(channel.getId(), other.getId()), provider.channelIds());
        assertEquals(channel.getCreatedAt(), provider.channelCreatedAt(channel.getId()).orElseThrow());
        assertTrue(provider.channelCreatedAt(-1L).isEmpty());
    }
}
