package io.github.davidhlp.spring.cache.tiered.tier.redis;

import io.github.davidhlp.spring.cache.tiered.support.MutableClock;
import io.github.davidhlp.spring.cache.tiered.tier.CacheTierException;
import io.github.davidhlp.spring.cache.tiered.tier.TierEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisKeyCommands;
import org.springframework.data.redis.connection.RedisSetCommands;
import org.springframework.data.redis.connection.RedisStringCommands;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/** Redis 二级缓存适配器测试（模拟 RedisTemplate） */
@SuppressWarnings("unchecked")
class RedisCacheTierTest {

    private static final String NS = "app:";

    private RedisTemplate<String, byte[]> valueTemplate;
    private ValueOperations<String, byte[]> valueOps;
    private StringRedisTemplate indexTemplate;
    private SetOperations<String, String> setOps;
    private RedisConnection connection;
    private RedisKeyCommands keyCommands;
    private RedisStringCommands stringCommands;
    private MutableClock clock;
    private RedisCacheTier tier;

    @BeforeEach
    void setUp() {
        valueTemplate = mock(RedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        indexTemplate = mock(StringRedisTemplate.class);
        setOps = mock(SetOperations.class);
        connection = mock(RedisConnection.class);
        keyCommands = mock(RedisKeyCommands.class);
        stringCommands = mock(RedisStringCommands.class);
        clock = new MutableClock();
        when(valueTemplate.opsForValue()).thenReturn(valueOps);
        when(indexTemplate.opsForSet()).thenReturn(setOps);
        when(connection.keyCommands()).thenReturn(keyCommands);
        when(connection.stringCommands()).thenReturn(stringCommands);
        when(valueTemplate.execute(any(RedisCallback.class)))
                .thenAnswer(invocation -> ((RedisCallback<?>) invocation.getArgument(0)).doInRedis(connection));

        tier = new RedisCacheTier(valueTemplate, indexTemplate, NS, Duration.ofHours(1), clock);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private void pipelineReturns(List<Object> results) {
        doAnswer(invocation -> {
            ((RedisCallback<?>) invocation.getArgument(0)).doInRedis(connection);
            return results;
        }).when(valueTemplate).executePipelined(any(RedisCallback.class));
    }

    @Test
    void testGetReadsValueAndRemainingTtlInOnePipeline() {
        pipelineReturns(Arrays.asList(bytes("v"), 60_000L));

        TierEntry entry = tier.get("k");

        assertThat(entry.getKey()).isEqualTo("k");
        assertThat(entry.getValue()).isEqualTo(bytes("v"));
        assertThat(entry.getExpiresAt()).isEqualTo(clock.instant().plusSeconds(60));
        verify(stringCommands).get(bytes("app:k"));
        verify(keyCommands).pTtl(bytes("app:k"));
        verify(valueTemplate, times(1)).executePipelined(any(RedisCallback.class));
    }

    @Test
    void testGetWithoutExpiryOrValue() {
        pipelineReturns(Arrays.asList(bytes("v"), -1L));
        assertThat(tier.get("k").getExpiresAt()).isNull();

        pipelineReturns(Arrays.asList(null, -2L));
        assertThat(tier.get("other")).isNull();
    }

    @Test
    void testSetWithExplicitTtlIndexesTags() {
        TierEntry entry = TierEntry.builder().key("k").value(bytes("v")).tag("users").build();

        tier.set(entry, Duration.ofMinutes(10));

        verify(valueOps).set("app:k", entry.getValue(), Duration.ofMinutes(10));
        verify(setOps).add("app:__tag__:users", "k");
        verify(indexTemplate).expire("app:__tag__:users", Duration.ofMinutes(10));
    }

    @Test
    void testTagIndexTtlNotShortened() {
        when(indexTemplate.getExpire("app:__tag__:users")).thenReturn(7200L);
        TierEntry entry = TierEntry.builder().key("k").value(bytes("v")).tag("users").build();

        tier.set(entry, Duration.ofMinutes(10));

        verify(indexTemplate, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    void testSetUsesRemainingLifetimeWhenTtlMissing() {
        TierEntry remaining = TierEntry.builder()
                .key("a")
                .value(bytes("v"))
                .expiresAt(clock.instant().plusSeconds(90))
                .build();
        TierEntry expired = remaining.toBuilder().key("k").expiresAt(clock.instant().minusSeconds(5)).build();

        tier.set(remaining, null);
        tier.set(expired, null);

        verify(valueOps).set("app:a", remaining.getValue(), Duration.ofSeconds(90));
        verify(valueOps, never()).set(eq("app:k"), any(byte[].class), any(Duration.class));
        verify(valueTemplate).delete("app:k");
    }

    @Test
    void testConnectionFailureTranslated() {
        when(valueTemplate.executePipelined(any(RedisCallback.class)))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> tier.get("k"))
                .isInstanceOf(CacheTierException.class)
                .hasMessageContaining("Redis get failed");
    }

    @Test
    void testMgetKeepsPositions() {
        pipelineReturns(Arrays.asList(bytes("1"), 5_000L, null, -2L, bytes("3"), -1L));

        Map<String, TierEntry> found = tier.mget(Arrays.asList("a", "b", "c"));

        assertThat(found).containsOnlyKeys("a", "c");
        assertThat(found.get("a").getExpiresAt()).isEqualTo(clock.instant().plusSeconds(5));
        assertThat(found.get("c").getValue()).isEqualTo(bytes("3"));
        assertThat(found.get("c").getExpiresAt()).isNull();
        verify(valueTemplate, times(1)).executePipelined(any(RedisCallback.class));
    }

    @Test
    void testMsetUsesPipeline() {
        RedisSetCommands setCommands = mock(RedisSetCommands.class);
        when(connection.setCommands()).thenReturn(setCommands);
        pipelineReturns(Collections.emptyList());

        tier.mset(Arrays.asList(
                TierEntry.builder().key("a").value(bytes("1")).tag("t").build(),
                TierEntry.builder().key("b").value(bytes("2")).build()), Duration.ofMinutes(5));

        verify(valueTemplate, times(1)).executePipelined(any(RedisCallback.class));
        verify(stringCommands, times(2)).set(any(byte[].class), any(byte[].class), any(), any());
        verify(setCommands).sAdd(bytes("app:__tag__:t"), bytes("a"));
        verify(keyCommands).expire(bytes("app:__tag__:t"), Duration.ofHours(1).getSeconds());
    }

    @Test
    void testDeleteByTagsReturnsOnlyExistingKeys() {
        when(setOps.members("app:__tag__:users")).thenReturn(new LinkedHashSet<>(Arrays.asList("a", "b")));
        pipelineReturns(Arrays.asList(1L, 0L));

        Set<String> deleted = tier.deleteByTags(Collections.singletonList("users"));

        assertThat(deleted).containsExactly("a");
        verify(indexTemplate).delete(Collections.singletonList("app:__tag__:users"));
    }

    @Test
    void testDeleteByPatternScansNamespaceAndSkipsTagIndex() {
        Cursor<byte[]> cursor = mock(Cursor.class);
        when(cursor.hasNext()).thenReturn(true, true, true, false);
        when(cursor.next()).thenReturn(bytes("app:user:1"), bytes("app:__tag__:users"), bytes("app:user:2"));
        when(keyCommands.scan(any(ScanOptions.class))).thenReturn(cursor);
        pipelineReturns(Arrays.asList(1L, 1L));

        Set<String> deleted = tier.deleteByPattern("user:*");

        assertThat(deleted).containsExactly("user:1", "user:2");
        verify(keyCommands).del(bytes("app:user:1"));
        verify(keyCommands).del(bytes("app:user:2"));
        verify(keyCommands, never()).del(bytes("app:__tag__:users"));
        verify(cursor).close();
    }

    @Test
    void testPing() {
        when(connection.ping()).thenReturn("PONG");
        assertThatCode(() -> tier.ping()).doesNotThrowAnyException();

        when(connection.ping()).thenReturn("LOADING");
        assertThatThrownBy(() -> tier.ping()).isInstanceOf(CacheTierException.class);
    }
}
