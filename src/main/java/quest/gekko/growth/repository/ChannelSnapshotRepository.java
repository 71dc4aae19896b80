package quest.gekko.growth.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.growth.domain.ChannelSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ChannelSnapshotRepository extends JpaRepository<ChannelSnapshot, Long> {
    Optional<ChannelSnapshot> findTopByChannelIdAndRecordedAtLessThanEqualOrderByRecordedAtDescIdDesc(Long channelId, Instant cutoff);

    @Query("""
        select s from ChannelSnapshot s
        where s.channel.id = :channelId
          and s.recordedAt >= :from
          and s.recordedAt <= :to
        order by s.recordedAt asc, s.id asc
        """)
    List<ChannelSnapshot> findWindow(@Param("channelId") Long channelId, @Param("from") Instant from, @Param("to") Instant to);
}
