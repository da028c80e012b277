package io.github.davidhlp.spring.cache.tiered.config;

import io.github.davidhlp.spring.cache.tiered.core.TieredCacheCoordinator;
import io.github.davidhlp.spring.cache.tiered.serialization.ValueCodec;
import io.github.davidhlp.spring.cache.tiered.stats.CacheStatisticsReporter;
import io.github.davidhlp.spring.cache.tiered.tier.CacheTier;
import io.github.davidhlp.spring.cache.tiered.tier.DurableCacheStore;
import io.github.davidhlp.spring.cache.tiered.tier.jdbc.JdbcDurableStore;
import io.github.davidhlp.spring.cache.tiered.tier.redis.RedisCacheTier;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * 三级缓存自动配置主入口
 *
 * <p>职责： 1. 注册 Redis 二级缓存和 JDBC 持久存储适配器 2. 组装协调器 3. 注册统计日志与健康检查。
 * 用户自定义的同名/同类型 Bean 优先。
 */
@Slf4j
@AutoConfiguration(after = {RedisAutoConfiguration.class, JdbcTemplateAutoConfiguration.class})
@ConditionalOnProperty(prefix = "cache.tiered", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TieredCacheProperties.class)
public class TieredCacheAutoConfiguration {

	public static final String REMOTE_TIER_BEAN_NAME = "remoteCacheTier";

	@PostConstruct
	public void init() {
		log.info("Initializing Tiered Cache Configuration");
	}

	@Bean
	@ConditionalOnMissingBean
	public ValueCodec tieredCacheValueCodec(TieredCacheProperties properties) {
		return new ValueCodec(properties.getCompressionThreshold());
	}

	@Bean(destroyMethod = "close")
	@ConditionalOnMissingBean
	@ConditionalOnBean(value = DurableCacheStore.class, name = REMOTE_TIER_BEAN_NAME)
	public TieredCacheCoordinator tieredCacheCoordinator(
			TieredCacheProperties properties,
			@Qualifier(REMOTE_TIER_BEAN_NAME) CacheTier remoteCacheTier,
			DurableCacheStore durableCacheStore,
			ValueCodec valueCodec) {
		return new TieredCacheCoordinator(properties, remoteCacheTier, durableCacheStore, valueCodec);
	}

	@Bean(destroyMethod = "close")
	@ConditionalOnMissingBean
	@ConditionalOnBean(TieredCacheCoordinator.class)
	public CacheStatisticsReporter tieredCacheStatisticsReporter(
			TieredCacheCoordinator coordinator, TieredCacheProperties properties) {
		CacheStatisticsReporter reporter = new CacheStatisticsReporter(
				coordinator::getStatistics, coordinator::getPerformanceMetrics, properties.getStatsReportInterval());
		reporter.start();
		return reporter;
	}

	/**
	 * 二级缓存：Spring Data Redis
	 */
	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass(RedisConnectionFactory.class)
	@ConditionalOnBean(RedisConnectionFactory.class)
	static class RedisTierConfiguration {

		@Bean(name = REMOTE_TIER_BEAN_NAME)
		@ConditionalOnMissingBean(name = REMOTE_TIER_BEAN_NAME)
		public CacheTier remoteCacheTier(RedisConnectionFactory connectionFactory, TieredCacheProperties properties) {
			RedisTemplate<String, byte[]> valueTemplate = new RedisTemplate<>();
			valueTemplate.setConnectionFactory(connectionFactory);
			valueTemplate.setKeySerializer(new StringRedisSerializer());
			valueTemplate.setValueSerializer(RedisSerializer.byteArray());
			valueTemplate.setHashKeySerializer(new StringRedisSerializer());
			valueTemplate.setHashValueSerializer(RedisSerializer.byteArray());
			valueTemplate.afterPropertiesSet();

			StringRedisTemplate indexTemplate = new StringRedisTemplate(connectionFactory);

			log.info("Registering redis cache tier: namespace={}", properties.getRedis().getNamespace());
			return new RedisCacheTier(
					valueTemplate,
					indexTemplate,
					properties.getRedis().getNamespace(),
					properties.getL2DefaultTtl(),
					Clock.systemUTC());
		}
	}

	/**
	 * 三级缓存：Spring JDBC
	 */
	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass(JdbcTemplate.class)
	@ConditionalOnBean(JdbcTemplate.class)
	static class JdbcStoreConfiguration {

		@Bean
		@ConditionalOnMissingBean(DurableCacheStore.class)
		public JdbcDurableStore durableCacheStore(JdbcTemplate jdbcTemplate, TieredCacheProperties properties) {
			JdbcDurableStore store =
					new JdbcDurableStore(jdbcTemplate, properties.getDurable().getTableName(), Clock.systemUTC());
			if (properties.getDurable().isInitializeSchema()) {
				store.initializeSchema();
			}
			log.info("Registering jdbc durable store: table={}", properties.getDurable().getTableName());
			return store;
		}
	}

	/**
	 * Actuator 健康检查
	 */
	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
	static class HealthIndicatorConfiguration {

		@Bean
		@ConditionalOnMissingBean(name = "tieredCacheHealthIndicator")
		@ConditionalOnBean(TieredCacheCoordinator.class)
		public TieredCacheHealthIndicator tieredCacheHealthIndicator(TieredCacheCoordinator coordinator) {
			return new TieredCacheHealthIndicator(coordinator);
		}
	}
}
