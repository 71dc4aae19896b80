package quest.gekko.growth.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "channel", uniqueConstraints = @UniqueConstraint(columnNames = { "platform_id" }))
@Getter @Setter
public class Channel {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "platform_id", nullable = false)
    String platformId;

    @Column(nullable = false)
    String title;

    String thumbnailUrl;

    @Column(nullable = false)
    Instant createdAt = Instant.now();
}
