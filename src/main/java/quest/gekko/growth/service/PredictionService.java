package quest.gekko.growth.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import quest.gekko.growth.config.CacheConfig;
import quest.gekko.growth.domain.Channel;
import quest.gekko.growth.domain.Prediction;
import quest.gekko.growth.ml.feature.FeatureExtractor;
import quest.gekko.growth.ml.feature.FeatureVector;
import quest.gekko.growth.ml.predict.GrowthPredictor;
import quest.gekko.growth.ml.predict.PredictionResult;
import quest.gekko.growth.repository.ChannelRepository;
import quest.gekko.growth.repository.PredictionRepository;
import quest.gekko.growth.web.dto.PredictionDTO;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionService {

    private static final int RANKING_SIZE = 10;

    private final ChannelRepository channelRepository;
    private final PredictionRepository predictionRepository;
    private final FeatureExtractor featureExtractor;
    private final GrowthPredictor predictor;
    private final Clock clock;

    /**
     * Predicts and stores growth for every channel, one at a time. A channel that fails is logged and counted;
     * the remaining channels are still processed.
     */
    @CacheEvict(value = CacheConfig.LATEST_PREDICTIONS, allEntries = true)
    public BatchReport predictAll() {
        Instant asOf = clock.instant();
        List<Channel> channels = channelRepository.findAll();
        record Ranked(String title, PredictionResult result) {}
        List<Ranked> ranked = new ArrayList<>();

        log.info("Predicting growth for {} channels as of {} ({} model)", channels.size(), asOf,
                predictor.isLoaded() ? "trained" : "rule-based");

        for (Channel channel : channels) {
            try {
                FeatureVector features = featureExtractor.extract(channel.getId(), asOf);
                PredictionResult result = predictor.predict(features);
                predictionRepository.save(toEntity(channel, features, result, asOf));
                ranked.add(new Ranked(channel.getTitle(), result));
            } catch (Exception e) {
                log.warn("Prediction failed for channel {} ({}): {}", channel.getId(), channel.getTitle(), e.getMessage(), e);
            }
        }

        ranked.sort(Comparator.comparingDouble((Ranked r) -> r.result().predictedGrowthRate()).reversed());
        for (int i = 0; i < Math.min(RANKING_SIZE, ranked.size()); i++) {
            Ranked r = ranked.get(i);
            log.info("{}. {} {}% (confidence {}%)", i + 1, r.title(),
                    String.format("%+.1f", r.result().predictedGrowthRate()),
                    Math.round(r.result().confidenceScore() * 100));
        }

        BatchReport report = new BatchReport(ranked.size(), channels.size());
        log.info("Prediction finished: {} channels", report);
        return report;
    }

    /** Live forecast from the channel's current history, without storing it. */
    public PredictionResult forecast(Long channelId) {
        return predictor.predict(featureExtractor.extract(channelId));
    }

    @Cacheable(value = CacheConfig.LATEST_PREDICTIONS, key = "#channelId")
    public Optional<PredictionDTO> latestFor(Long channelId) {
        return predictionRepository.findTopByChannelIdOrderByCreatedAtDescIdDesc(channelId)
                .map(p -> PredictionDTO.of(channelId, p));
    }

    private Prediction toEntity(Channel channel, FeatureVector features, PredictionResult result, Instant asOf) {
        Prediction prediction = new Prediction();
        prediction.setChannel(channel);
        prediction.setPredictedGrowthRate(result.predictedGrowthRate());
        prediction.setConfidenceScore(result.confidenceScore());
        prediction.setMode(result.mode());
        prediction.setFeatureSubscriberGrowthRate(features.subscriberGrowthRate30d());
        prediction.setFeatureViewGrowthRate(features.viewGrowthRate30d());
        prediction.setFeatureUploadFrequency(features.uploadFrequency());
        prediction.setFeatureEngagementRate(features.engagementRate());
        prediction.setFeatureTrendScore(features.trendScore());
        prediction.setFeatureNewsCount(features.newsCount());
        prediction.setFeatureNewsPositiveRatio(features.newsPositiveRatio());
        prediction.setCreatedAt(asOf);
        return prediction;
    }
}
