package quest.gekko.growth.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * One timestamped measurement of a channel's public counters. Snapshots are append-only.
 */
@Entity
@Table(name = "channel_snapshot", indexes = @Index(columnList = "channel_id, recorded_at"))
@Getter @Setter
public class ChannelSnapshot {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "channel_id", nullable = false)
    Channel channel;

    @Column(nullable = false)
    long subscriberCount;

    @Column(nullable = false)
    long viewCount;

    @Column(nullable = false)
    long videoCount;

    @Column(name = "recorded_at", nullable = false)
    Instant recordedAt;
}
