package quest.gekko.growth.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String LATEST_PREDICTIONS = "latestPredictions";

    @Bean
    public Caffeine<Object, Object> caffeine() {
        // predict-all runs daily and evicts everything on completion
        return Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofHours(6));
    }

    @Bean
    public CacheManager cacheManager(final Caffeine<Object, Object> caffeine) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager(LATEST_PREDICTIONS);
        cacheManager.setCaffeine(caffeine);
        return cacheManager;
    }
}
