package com.example.filegate.observability.health;

import com.example.filegate.storage.StorageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reports whether a default storage is configured and its backend can be reached.
 * Exposed as /actuator/health/defaultStorage.
 */
@Slf4j
@Component("defaultStorageHealthIndicator")
@RequiredArgsConstructor
public class DefaultStorageHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final StorageRepository storageRepository;

    @Override
    public Mono<Health> health() {
        return storageRepository.findDefaultStorage()
                .flatMap(storage -> storage.isReachable()
                        .timeout(TIMEOUT)
                        .onErrorResume(e -> {
                            log.warn("Health check of storage {} failed: {}", storage.getUid(), e.getMessage());
                            return Mono.just(false);
                        })
                        .map(reachable -> (reachable ? Health.up() : Health.down())
                                .withDetail("uid", storage.getUid())
                                .withDetail("name", storage.getName())
                                .withDetail("driver", storage.getDriver().name())
                                .build()))
                .defaultIfEmpty(Health.outOfService()
                        .withDetail("reason", "No default storage configured")
                        .build());
    }
}
