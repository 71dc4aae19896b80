package quest.gekko.growth.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import quest.gekko.growth.ml.feature.FeatureExtractor;
import quest.gekko.growth.ml.feature.FeatureVector;
import quest.gekko.growth.ml.predict.PredictionResult;
import quest.gekko.growth.service.PredictionService;
import quest.gekko.growth.web.dto.PredictionDTO;

import java.time.Instant;

@RestController
@RequestMapping("/api/channels/{channelId}")
@RequiredArgsConstructor
public class ChannelForecastController {

    private final FeatureExtractor featureExtractor;
    private final PredictionService predictionService;

    @GetMapping("/features")
    public FeatureVector features(@PathVariable Long channelId,
                                  @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf) {
        return asOf == null ? featureExtractor.extract(channelId) : featureExtractor.extract(channelId, asOf);
    }

    @GetMapping("/forecast")
    public PredictionResult forecast(@PathVariable Long channelId) {
        return predictionService.forecast(channelId);
    }

    @GetMapping("/prediction")
    public PredictionDTO latestPrediction(@PathVariable Long channelId) {
        return predictionService.latestFor(channelId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No prediction for channel " + channelId));
    }
}
