package quest.gekko.growth.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "news_event", indexes = @Index(columnList = "channel_id, published_at"))
@Getter @Setter
public class NewsEvent {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "channel_id", nullable = false)
    Channel channel;

    @Column(nullable = false, length = 500)
    String title;

    @Column(length = 1000)
    String url;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    NewsCategory category = NewsCategory.OTHER;

    @Column(name = "published_at")
    Instant publishedAt;
}
