package quest.gekko.growth.ml.feature;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.growth.domain.Channel;
import quest.gekko.growth.domain.ChannelSnapshot;
import quest.gekko.growth.domain.NewsEvent;
import quest.gekko.growth.domain.TrendObservation;
import quest.gekko.growth.repository.ChannelRepository;
import quest.gekko.growth.repository.ChannelSnapshotRepository;
import quest.gekko.growth.repository.NewsEventRepository;
import quest.gekko.growth.repository.TrendObservationRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaHistoricalDataProvider implements HistoricalDataProvider {

    private final ChannelRepository channelRepository;
    private final ChannelSnapshotRepository snapshotRepository;
    private final NewsEventRepository newsRepository;
    private final TrendObservationRepository trendRepository;

    @Override
    public List<Long> channelIds() {
        return channelRepository.findAllIds();
    }

    @Override
    public Optional<Instant> channelCreatedAt(Long channelId) {
        return channelRepository.findById(channelId).map(Channel::getCreatedAt);
    }

    @Override
    public Optional<ChannelSnapshot> latestSnapshot(Long channelId, Instant cutoff) {
        return snapshotRepository.findTopByChannelIdAndRecordedAtLessThanEqualOrderByRecordedAtDescIdDesc(channelId, cutoff);
    }

    @Override
    public List<ChannelSnapshot> snapshots(Long channelId, Instant from, Instant to) {
        return snapshotRepository.findWindow(channelId, from, to);
    }

    @Override
    public List<NewsEvent> news(Long channelId, Instant from, Instant to) {
        return newsRepository.findWindow(channelId, from, to);
    }

    @Override
    public List<TrendObservation> trends(Long channelId, Instant from, Instant to) {
        return trendRepository.findWindow(channelId, from, to);
    }
}
