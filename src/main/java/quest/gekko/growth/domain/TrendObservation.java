package quest.gekko.growth.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "trend_observation", indexes = @Index(columnList = "channel_id, recorded_at"))
@Getter @Setter
public class TrendObservation {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "channel_id", nullable = false)
    Channel channel;

    // search interest, 0-100
    @Column(nullable = false)
    int score;

    @Column(name = "recorded_at", nullable = false)
    Instant recordedAt;
}
