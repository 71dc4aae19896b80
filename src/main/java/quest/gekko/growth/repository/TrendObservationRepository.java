package quest.gekko.growth.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.growth.domain.TrendObservation;

import java.time.Instant;
import java.util.List;

public interface TrendObservationRepository extends JpaRepository<TrendObservation, Long> {
    @Query("""
        select t from TrendObservation t
        where t.channel.id = :channelId
          and t.recordedAt >= :from
          and t.recordedAt <= :to
        order by t.recordedAt asc, t.id asc
        """)
    List<TrendObservation> findWindow(@Param("channelId") Long channelId, @Param("from") Instant from, @Param("to") Instant to);
}
