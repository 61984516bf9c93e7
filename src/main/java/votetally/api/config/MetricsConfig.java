package votetally.api.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter votesAcceptedCounter(MeterRegistry registry) {
        return Counter.builder("votetally.votes.accepted")
                .description("Total number of votes written to storage")
                .register(registry);
    }

    @Bean
    public Counter votesRejectedCounter(MeterRegistry registry) {
        return Counter.builder("votetally.votes.rejected")
                .description("Total number of submissions refused before storage")
                .register(registry);
    }
}
