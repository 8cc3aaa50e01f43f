package hbnb.listing.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Metrics configuration: common tags on every meter, including the
 * listing.entity.mutations counters recorded by the facade
 */
@Slf4j
@Configuration
public class MetricsConfig {

    @Bean
    public List<Tag> commonTags(@Value("${spring.application.name:rental-listing}") String applicationName) {
        return List.of(
            Tag.of("service", applicationName),
            Tag.of("component", "listing-facade")
        );
    }

    @Bean
    public MeterBinder commonTagsBinder(List<Tag> commonTags) {
        return (MeterRegistry registry) -> {
            registry.config().commonTags(commonTags);
            log.info("Registered common metric tags: {}", commonTags);
        };
    }
}
