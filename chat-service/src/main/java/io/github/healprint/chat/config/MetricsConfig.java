package io.github.healprint.chat.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.List;

/**
 * Meters published by the chat service:
 *
 * <ul>
 *   <li>http_server_requests_seconds_* for the REST routes
 *   <li>healprint_store_operation_seconds_* per document store operation and outcome
 *   <li>healprint_cache_hits/misses/errors_total for the session cache
 * </ul>
 */
@ApplicationScoped
public class MetricsConfig {

    static final String APPLICATION = "healprint-chat-service";
    static final String STORE_TIMER = "healprint.store.operation";
    static final String HTTP_TIMER = "http.server.requests";

    @Produces
    @Singleton
    public MeterFilter applicationTagFilter() {
        return MeterFilter.commonTags(List.of(Tag.of("application", APPLICATION)));
    }

    @Produces
    @Singleton
    public MeterFilter latencyHistogramFilter() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(
                    Meter.Id id, DistributionStatisticConfig config) {
                if (id.getName().startsWith(STORE_TIMER)) {
                    // Store calls are bounded by the Mongo client timeouts.
                    return latencyHistogram(Duration.ofMillis(1), Duration.ofSeconds(10))
                            .merge(config);
                }
                if (id.getName().startsWith(HTTP_TIMER)) {
                    // Turns include the completion call, which may take up to a minute.
                    return latencyHistogram(Duration.ofMillis(5), Duration.ofSeconds(60))
                            .merge(config);
                }
                return config;
            }
        };
    }

    private static DistributionStatisticConfig latencyHistogram(Duration min, Duration max) {
        return DistributionStatisticConfig.builder()
                .percentiles(0.5, 0.95, 0.99)
                .percentilesHistogram(true)
                .minimumExpectedValue((double) min.toNanos())
                .maximumExpectedValue((double) max.toNanos())
                .build();
    }
}
