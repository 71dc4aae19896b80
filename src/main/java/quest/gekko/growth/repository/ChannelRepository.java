package quest.gekko.growth.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import quest.gekko.growth.domain.Channel;

import java.util.List;

public interface ChannelRepository extends JpaRepository<Channel, Long> {
    @Query("select c.id from Channel c order by c.id")
    List<Long> findAllIds();
}
