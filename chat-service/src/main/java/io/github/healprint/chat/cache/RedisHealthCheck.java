package io.github.healprint.chat.cache;

import io.quarkus.redis.client.RedisClientName;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.vertx.mutiny.redis.client.Response;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Reports the session cache backend. A down cache never makes the service unusable, so the check
 * stays UP with {@code mode=degraded} when Redis cannot be reached.
 */
@Readiness
@ApplicationScoped
public class RedisHealthCheck implements HealthCheck {

    private static final String NAME = "Session cache";
    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    @ConfigProperty(name = "healprint.cache.type", defaultValue = "none")
    String cacheType;

    @Any @Inject Instance<ReactiveRedisDataSource> redisSources;

    @ConfigProperty(name = "healprint.cache.redis.client")
    Optional<String> clientName;

    @Override
    public HealthCheckResponse call() {
        if (!"redis".equalsIgnoreCase(cacheType)) {
            return HealthCheckResponse.named(NAME).up().withData("mode", "disabled").build();
        }

        try {
            Instance<ReactiveRedisDataSource> selected =
                    clientName
                            .filter(name -> !name.isBlank())
                            .map(name -> redisSources.select(RedisClientName.Literal.of(name)))
                            .orElse(redisSources);

            if (selected.isUnsatisfied()) {
                return HealthCheckResponse.named(NAME)
                        .up()
                        .withData("mode", "degraded")
                        .withData("reason", "No Redis client available")
                        .build();
            }

            Response response = selected.get().execute("PING").await().atMost(TIMEOUT);

            return HealthCheckResponse.named(NAME)
                    .up()
                    .withData("mode", "redis")
                    .withData("response", response.toString())
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named(NAME)
                    .up()
                    .withData("mode", "degraded")
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
