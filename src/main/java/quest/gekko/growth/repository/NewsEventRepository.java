package quest.gekko.growth.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.growth.domain.NewsEvent;

import java.time.Instant;
import java.util.List;

public interface NewsEventRepository extends JpaRepository<NewsEvent, Long> {
    @Query("""
        select n from NewsEvent n
        where n.channel.id = :channelId
          and n.publishedAt >= :from
          and n.publishedAt <= :to
        order by n.publishedAt asc
        """)
    List<NewsEvent> findWindow(@Param("channelId") Long channelId, @Param("from") Instant from, @Param("to") Instant to);
}
