package quest.gekko.growth.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import quest.gekko.growth.ml.predict.PredictionMode;

import java.time.Instant;

@Entity
@Table(name = "prediction", indexes = @Index(columnList = "channel_id, created_at"))
@Getter @Setter
public class Prediction {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "channel_id", nullable = false)
    Channel channel;

    // expected subscriber growth over the horizon, percent
    @Column(nullable = false)
    double predictedGrowthRate;

    double confidenceScore;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    PredictionMode mode;

    // feature values the prediction was made from
    Double featureSubscriberGrowthRate;
    Double featureViewGrowthRate;
    Double featureUploadFrequency;
    Double featureEngagementRate;
    Integer featureTrendScore;
    Integer featureNewsCount;
    Double featureNewsPositiveRatio;

    @Column(name = "created_at", nullable = false)
    Instant createdAt = Instant.now();
}
