package quickpoll.websockets.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import quickpoll.websockets.websocket.SubscriptionRegistry;

@Configuration
public class MetricsConfig {

    @Bean
    public Gauge activeConnectionsGauge(MeterRegistry registry, SubscriptionRegistry subscriptionRegistry) {
        return Gauge.builder("quickpoll.websocket.connections", subscriptionRegistry, SubscriptionRegistry::connectionCount)
                .description("Number of open WebSocket connections")
                .register(registry);
    }

    @Bean
    public Gauge subscribedPollsGauge(MeterRegistry registry, SubscriptionRegistry subscriptionRegistry) {
        return Gauge.builder("quickpoll.websocket.topics", subscriptionRegistry, SubscriptionRegistry::topicCount)
                .description("Number of polls with at least one subscriber")
                .register(registry);
    }

    @Bean
    public Counter votesCounter(MeterRegistry registry) {
        return Counter.builder("quickpoll.votes.total")
                .description("Total number of votes cast")
                .register(registry);
    }

    @Bean
    public Counter likesCounter(MeterRegistry registry) {
        return Counter.builder("quickpoll.likes.toggled")
                .description("Total number of like toggles")
                .register(registry);
    }
}
