package io.github.davidhlp.spring.cache.tiered.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "cache.tiered")
public class TieredCacheProperties {

	private boolean enabled = true;

	/**
	 * 一级缓存容量（条目数）
	 */
	private int l1MaxSize = 1000;

	private Duration l1DefaultTtl = Duration.ofMinutes(5);

	/**
	 * 内存估算的总量，仅用于统计
	 */
	private long l1MaxMemoryBytes = 64L * 1024 * 1024;

	private Duration l2DefaultTtl = Duration.ofHours(1);

	private Duration l3DefaultTtl = Duration.ofHours(24);

	/**
	 * 连续失败多少次后熔断器打开
	 */
	private int failureThreshold = 5;

	private Duration breakerCooldown = Duration.ofSeconds(30);

	/**
	 * 试探失败后冷却时间的增长倍数，1.0 表示不增长
	 */
	private double breakerBackoffMultiplier = 1.0;

	private Duration maxBreakerCooldown = Duration.ofMinutes(5);

	private boolean guardDurableStore = true;

	/**
	 * 单次二级/三级缓存调用的超时时间
	 */
	private Duration tierTimeout = Duration.ofSeconds(2);

	private int maxValueBytes = 1024 * 1024;

	private int compressionThreshold = 1024;

	private int maxKeyLength = 250;

	private boolean asyncWrites = true;

	private Duration versionRetention = Duration.ofMinutes(1);

	/**
	 * 统计日志输出间隔，0 表示关闭
	 */
	private Duration statsReportInterval = Duration.ofMinutes(5);

	private Redis redis = new Redis();

	private Durable durable = new Durable();

	@Data
	public static class Redis {

		private String namespace = "tiered-cache:";
	}

	@Data
	public static class Durable {

		private String tableName = "cache_entry";

		/**
		 * 启动时执行内置建表脚本
		 */
		private boolean initializeSchema = false;
	}
}
