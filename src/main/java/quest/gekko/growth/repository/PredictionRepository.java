package quest.gekko.growth.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.growth.domain.Prediction;

import java.util.Optional;

public interface PredictionRepository extends JpaRepository<Prediction, Long> {
    Optional<Prediction> findTopByChannelIdOrderByCreatedAtDescIdDesc(Long channelId);
}
