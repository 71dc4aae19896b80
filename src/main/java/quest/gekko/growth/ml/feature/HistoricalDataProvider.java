package quest.gekko.growth.ml.feature;

import quest.gekko.growth.domain.ChannelSnapshot;
import quest.gekko.growth.domain.NewsEvent;
import quest.gekko.growth.domain.TrendObservation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the history collected for each channel. All window bounds are inclusive.
 */
public interface HistoricalDataProvider {

    List<Long> channelIds();

    /** Empty when the channel does not exist. */
    Optional<Instant> channelCreatedAt(Long channelId);

    /** Latest snapshot recorded at or before {@code cutoff}. */
    Optional<ChannelSnapshot> latestSnapshot(Long channelId, Instant cutoff);

    /** Snapshots recorded in {@code [from, to]}, oldest first. */
    List<ChannelSnapshot> snapshots(Long channelId, Instant from, Instant to);

    /** News published in {@code [from, to]}. */
    List<NewsEvent> news(Long channelId, Instant from, Instant to);

    /** Trend observations recorded in {@code [from, to]}, oldest first. */
    List<TrendObservation> trends(Long channelId, Instant from, Instant to);
}
