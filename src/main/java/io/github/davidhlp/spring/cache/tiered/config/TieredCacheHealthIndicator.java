package io.github.davidhlp.spring.cache.tiered.config;

import io.github.davidhlp.spring.cache.tiered.core.TieredCacheCoordinator;
import io.github.davidhlp.spring.cache.tiered.stats.CacheHealth;
import io.github.davidhlp.spring.cache.tiered.stats.CacheStatistics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;

@Slf4j
public class TieredCacheHealthIndicator implements HealthIndicator {

	public static final Status DEGRADED = new Status("DEGRADED", "Local cache available, remote tier unavailable");

	private final TieredCacheCoordinator coordinator;

	public TieredCacheHealthIndicator(TieredCacheCoordinator coordinator) {
		this.coordinator = coordinator;
	}

	@Override
	public Health health() {
		try {
			CacheHealth health = coordinator.healthCheck();
			CacheStatistics statistics = coordinator.getStatistics();

			Health.Builder builder;
			switch (health.status()) {
				case HEALTHY:
					builder = Health.up();
					break;
				case DEGRADED:
					builder = Health.status(DEGRADED);
					break;
				default:
					builder = Health.down();
					break;
			}
			builder.withDetail("local", health.local())
					.withDetail("remote", health.remote())
					.withDetail("durable", health.durable())
					.withDetail("latencyMillis", health.latencyMillis())
					.withDetail("l1Entries", statistics.l1().entries())
					.withDetail("l1HitRate", statistics.l1().hitRate())
					.withDetail("remoteBreaker", statistics.remoteBreaker().state().name());
			if (statistics.durableBreaker() != null) {
				builder.withDetail("durableBreaker", statistics.durableBreaker().state().name());
			}
			return builder.build();
		} catch (Exception e) {
			log.error("Tiered cache health check failed", e);
			return Health.down()
					.withDetail("status", "Tiered cache health check failed")
					.withDetail("error", e.getMessage())
					.build();
		}
	}
}
