package io.github.davidhlp.spring.cache.tiered.management;

import cn.hutool.crypto.digest.DigestUtil;

import io.github.davidhlp.spring.cache.tiered.core.CacheConstants;
import io.github.davidhlp.spring.cache.tiered.core.CacheValidationException;

import lombok.extern.slf4j.Slf4j;

import org.springframework.util.StringUtils;

import java.util.regex.Pattern;

/**
 * 统一的缓存键管理器
 * 负责缓存键的校验、规范化和格式化
 */
@Slf4j
public class CacheKeyManager {

    private final int maxKeyLength;

    public CacheKeyManager(int maxKeyLength) {
        this.maxKeyLength = maxKeyLength;
    }

    /**
     * 校验并规范化缓存键
     *
     * <p>超过最大长度的键替换为 {@code hashed:<sha256>}，保证各层使用相同的键。
     *
     * @param key 原始键
     * @return 实际存储使用的键
     * @throws CacheValidationException 键为空或空白
     */
    public String normalize(String key) {
        if (!StringUtils.hasText(key)) {
            throw new CacheValidationException("Cache key must not be blank");
        }
        if (key.length() > maxKeyLength) {
            String hashed = CacheConstants.HASHED_KEY_PREFIX + DigestUtil.sha256Hex(key);
            log.debug("Cache key too long ({} characters), hashed to: {}", key.length(), hashed);
            return hashed;
        }
        return key;
    }

    /**
     * 将 glob 模式（{@code *} 任意字符，{@code ?} 单个字符）转换为正则
     */
    public static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    /**
     * 格式化缓存键用于日志输出
     *
     * @param key 缓存键
     * @return 格式化后的键字符串
     */
    public static String formatKeyForLog(String key) {
        if (key == null) {
            return "null";
        }
        if (key.length() > CacheConstants.MAX_LOG_KEY_LENGTH) {
            return key.substring(0, CacheConstants.MAX_LOG_KEY_LENGTH - 3) + "...";
        }
        return key;
    }
}
