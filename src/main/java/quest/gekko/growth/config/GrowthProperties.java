package quest.gekko.growth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;
import quest.gekko.growth.ml.train.FeatureAnchor;

import java.nio.file.Path;

/**
 * Configuration properties for the growth model and its jobs
 */
@Configuration
@EnableConfigurationProperties({
        GrowthProperties.Model.class,
        GrowthProperties.Training.class
})
public class GrowthProperties {

    @ConfigurationProperties("growth.model")
    public record Model(@DefaultValue("data/model/growth-model.bin") Path path) {}

    @ConfigurationProperties("growth.training")
    public record Training(
            @DefaultValue("10") int minRows,
            @DefaultValue("180") int horizonDays,
            @DefaultValue("actualGrowthRate") String targetColumn,
            @DefaultValue("CURRENT") FeatureAnchor featureAnchor,
            @DefaultValue("0.05") double learningRate,
            @DefaultValue("1000") int maxRounds,
            @DefaultValue("50") int earlyStoppingRounds,
            @DefaultValue("0.2") double validationFraction,
            @DefaultValue("42") long seed,
            @DefaultValue("0.8") double subsample,
            @DefaultValue("20") int maxDepth,
            @DefaultValue("31") int maxNodes,
            @DefaultValue("3") int nodeSize
    ) {
        public static Training defaults() {
            return new Training(10, 180, "actualGrowthRate", FeatureAnchor.CURRENT,
                    0.05, 1000, 50, 0.2, 42L, 0.8, 20, 31, 3);
        }
    }
}
