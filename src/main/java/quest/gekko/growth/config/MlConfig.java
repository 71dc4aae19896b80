package quest.gekko.growth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import quest.gekko.growth.ml.model.ModelStore;
import quest.gekko.growth.ml.predict.GrowthPredictor;
import quest.gekko.growth.ml.train.GradientBoostingTrainer;

import java.time.Clock;

@Configuration
public class MlConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ModelStore modelStore(final GrowthProperties.Model model) {
        return new ModelStore(model.path());
    }

    @Bean
    public GradientBoostingTrainer gradientBoostingTrainer(final GrowthProperties.Training training, final Clock clock) {
        return new GradientBoostingTrainer(training, clock);
    }

    // Loads the current artifact, if any, when the context starts.
    @Bean
    public GrowthPredictor growthPredictor(final ModelStore modelStore, final GradientBoostingTrainer trainer) {
        return new GrowthPredictor(modelStore, trainer);
    }
}
