package io.github.davidhlp.spring.cache.tiered.management;

import io.github.davidhlp.spring.cache.tiered.core.CacheValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/** 缓存键管理测试 */
class CacheKeyManagerTest {

    private final CacheKeyManager keyManager = new CacheKeyManager(250);

    @Test
    void testShortKeyUnchanged() {
        assertThat(keyManager.normalize("user:1")).isEqualTo("user:1");
    }

    @Test
    void testLongKeyIsHashedDeterministically() {
        String longKey = "k".repeat(300);

        String normalized = keyManager.normalize(longKey);

        assertThat(normalized).startsWith("hashed:").hasSize("hashed:".length() + 64);
        assertThat(keyManager.normalize(longKey)).isEqualTo(normalized);
        assertThat(keyManager.normalize("k".repeat(301))).isNotEqualTo(normalized);
    }

    @Test
    void testBlankKeyRejected() {
        assertThatThrownBy(() -> keyManager.normalize(null)).isInstanceOf(CacheValidationException.class);
        assertThatThrownBy(() -> keyManager.normalize("  ")).isInstanceOf(CacheValidationException.class);
        assertThatThrownBy(() -> keyManager.normalize("")).isInstanceOf(CacheValidationException.class);
    }

    @Test
    void testGlobToRegex() {
        assertThat(CacheKeyManager.globToRegex("user:*").matcher("user:42").matches()).isTrue();
        assertThat(CacheKeyManager.globToRegex("user:*").matcher("order:42").matches()).isFalse();
        assertThat(CacheKeyManager.globToRegex("item.?").matcher("item.1").matches()).isTrue();
        assertThat(CacheKeyManager.globToRegex("item.?").matcher("itemx1").matches()).isFalse();
        assertThat(CacheKeyManager.globToRegex("a+b(*)").matcher("a+b(xyz)").matches()).isTrue();
    }

    @Test
    void testFormatKeyForLog() {
        assertThat(CacheKeyManager.formatKeyForLog("short")).isEqualTo("short");
        assertThat(CacheKeyManager.formatKeyForLog("x".repeat(200))).hasSize(100).endsWith("...");
    }
}
