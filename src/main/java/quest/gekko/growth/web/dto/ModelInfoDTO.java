package quest.gekko.growth.web.dto;

import java.time.Instant;
import java.util.Map;

public record ModelInfoDTO(boolean loaded, Instant trainedAt, Map<String, Double> featureImportance) {
}
