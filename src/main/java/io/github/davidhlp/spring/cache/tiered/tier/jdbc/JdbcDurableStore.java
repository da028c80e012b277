package io.github.davidhlp.spring.cache.tiered.tier.jdbc;

import io.github.davidhlp.spring.cache.tiered.tier.CacheTierException;
import io.github.davidhlp.spring.cache.tiered.tier.DurableCacheStore;
import io.github.davidhlp.spring.cache.tiered.tier.TierEntry;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * 基于 Spring JDBC 的持久存储（三级缓存）
 *
 * <p>单键读取不过滤过期行，由协调器判断并删除。读取会累加访问次数，用于预热排序。
 * 标签以逗号拼接存储，按 {@code CONCAT(',', tags, ',') LIKE '%,tag,%'} 匹配。
 */
@Slf4j
public class JdbcDurableStore implements DurableCacheStore {

    public static final String NAME = "jdbc";

    public static final String SCHEMA_LOCATION = "tiered-cache/schema.sql";

    private static final String TABLE_PLACEHOLDER = "${table}";
    private static final Pattern TABLE_NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final int IN_CLAUSE_BATCH_SIZE = 500;
    private static final char LIKE_ESCAPE = '!';

    private static final String COLUMNS =
            "cache_key, cache_value, tags, created_at, expires_at, access_count, last_accessed_at";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final String tableName;
    private final Clock clock;

    private final RowMapper<TierEntry> rowMapper = (rs, rowNum) -> {
        Timestamp createdAt = rs.getTimestamp("created_at");
        Timestamp expiresAt = rs.getTimestamp("expires_at");
        return TierEntry.builder()
                .key(rs.getString("cache_key"))
                .value(rs.getBytes("cache_value"))
                .tags(splitTags(rs.getString("tags")))
                .createdAt(createdAt != null ? createdAt.toInstant() : null)
                .expiresAt(expiresAt != null ? expiresAt.toInstant() : null)
                .accessCount(rs.getLong("access_count"))
                .build();
    };

    public JdbcDurableStore(JdbcTemplate jdbcTemplate, String tableName, Clock clock) {
        if (!TABLE_NAME_PATTERN.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.tableName = tableName;
        this.clock = clock;
    }

    /**
     * 执行内置建表脚本（CREATE TABLE IF NOT EXISTS）
     */
    public void initializeSchema() {
        String script = loadSchemaScript().replace(TABLE_PLACEHOLDER, tableName);
        jdbcTemplate.execute((ConnectionCallback<Void>) connection -> {
            ScriptUtils.executeSqlScript(connection, new ByteArrayResource(script.getBytes(StandardCharsets.UTF_8)));
            return null;
        });
        log.info("Durable cache schema initialized: table={}", tableName);
    }

    private static String loadSchemaScript() {
        try (InputStream in = new ClassPathResource(SCHEMA_LOCATION).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load durable cache schema: " + SCHEMA_LOCATION, e);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public TierEntry get(String key) {
        return execute("get", () -> {
            List<TierEntry> rows = jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM " + tableName + " WHERE cache_key = ?", rowMapper, key);
            if (rows.isEmpty()) {
                return null;
            }
            recordAccess(Collections.singletonList(key));
            TierEntry row = rows.get(0);
            return row.toBuilder().accessCount(row.getAccessCount() + 1).build();
        });
    }

    @Override
    public void set(TierEntry entry, Duration ttl) {
        Instant expiresAt = resolveExpiresAt(entry, ttl);
        execute("set", () -> {
            upsert(entry, expiresAt);
            return null;
        });
    }

    @Override
    public void delete(String key) {
        execute("delete", () -> jdbcTemplate.update("DELETE FROM " + tableName + " WHERE cache_key = ?", key));
    }

    @Override
    public Map<String, TierEntry> mget(List<String> keys) {
        if (keys.isEmpty()) {
            return Collections.emptyMap();
        }
        return execute("mget", () -> {
            Map<String, TierEntry> found = new HashMap<>();
            List<String> distinct = new ArrayList<>(new LinkedHashSet<>(keys));
            for (int start = 0; start < distinct.size(); start += IN_CLAUSE_BATCH_SIZE) {
                List<String> batch = distinct.subList(start, Math.min(start + IN_CLAUSE_BATCH_SIZE, distinct.size()));
                List<TierEntry> rows = namedJdbcTemplate.query(
                        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE cache_key IN (:keys)",
                        new MapSqlParameterSource("keys", batch),
                        rowMapper);
                for (TierEntry row : rows) {
                    found.put(row.getKey(), row.toBuilder().accessCount(row.getAccessCount() + 1).build());
                }
            }
            if (!found.isEmpty()) {
                recordAccess(new ArrayList<>(found.keySet()));
            }
            return found;
        });
    }

    /**
     * 逐键写入，单键失败不影响其余条目；全部失败时抛出异常
     */
    @Override
    public void mset(Collection<TierEntry> entries, Duration ttl) {
        if (entries.isEmpty()) {
            return;
        }
        int failures = 0;
        DataAccessException lastError = null;
        for (TierEntry entry : entries) {
            try {
                upsert(entry, resolveExpiresAt(entry, ttl));
            } catch (DataAccessException e) {
                failures++;
                lastError = e;
                log.warn("Failed to write durable entry: key={}, error={}", entry.getKey(), e.getMessage());
            }
        }
        if (failures == entries.size()) {
            throw new CacheTierException(NAME, "JDBC mset failed for all " + failures + " entries", lastError);
        }
    }

    @Override
    public Set<String> deleteByTags(Collection<String> tags) {
        if (tags.isEmpty()) {
            return Collections.emptySet();
        }
        return execute("deleteByTags", () -> {
            MapSqlParameterSource params = new MapSqlParameterSource();
            String condition = tagCondition(tags, params);
            List<String> keys = namedJdbcTemplate.queryForList(
                    "SELECT cache_key FROM " + tableName + " WHERE " + condition, params, String.class);
            return deleteKeys(keys);
        });
    }

    @Override
    public Set<String> deleteByPattern(String glob) {
        return execute("deleteByPattern", () -> {
            List<String> keys = jdbcTemplate.queryForList(
                    "SELECT cache_key FROM " + tableName + " WHERE cache_key LIKE ? ESCAPE '" + LIKE_ESCAPE + "'",
                    String.class,
                    globToLike(glob));
            return deleteKeys(keys);
        });
    }

    @Override
    public void ping() {
        execute("ping", () -> jdbcTemplate.queryForObject("SELECT 1", Integer.class));
    }

    @Override
    public List<TierEntry> findWarmCandidates(Collection<String> tags, int limit, Instant now) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return execute("findWarmCandidates", () -> {
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("now", Timestamp.from(now))
                    .addValue("limit", limit);
            StringBuilder sql = new StringBuilder("SELECT ")
                    .append(COLUMNS)
                    .append(" FROM ")
                    .append(tableName)
                    .append(" WHERE (expires_at IS NULL OR expires_at > :now)");
            if (tags != null && !tags.isEmpty()) {
                sql.append(" AND (").append(tagCondition(tags, params)).append(")");
            }
            sql.append(" ORDER BY access_count DESC, cache_key ASC LIMIT :limit");
            return namedJdbcTemplate.query(sql.toString(), params, rowMapper);
        });
    }

    /**
     * 删除过期行，返回删除数量
     */
    public int purgeExpired() {
        return execute("purgeExpired", () -> jdbcTemplate.update(
                "DELETE FROM " + tableName + " WHERE expires_at IS NOT NULL AND expires_at <= ?",
                Timestamp.from(clock.instant())));
    }

    private void upsert(TierEntry entry, Instant expiresAt) {
        Instant now = clock.instant();
        Timestamp createdAt = Timestamp.from(entry.getCreatedAt() != null ? entry.getCreatedAt() : now);
        Timestamp expires = expiresAt != null ? Timestamp.from(expiresAt) : null;
        String tags = joinTags(entry.getTags());

        int updated = jdbcTemplate.update(
                "UPDATE " + tableName + " SET cache_value = ?, tags = ?, created_at = ?, expires_at = ? WHERE cache_key = ?",
                entry.getValue(), tags, createdAt, expires, entry.getKey());
        if (updated > 0) {
            return;
        }
        try {
            jdbcTemplate.update(
                    "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
                    entry.getKey(), entry.getValue(), tags, createdAt, expires, entry.getAccessCount(), null);
        } catch (DuplicateKeyException e) {
            // 并发插入，改为更新
            jdbcTemplate.update(
                    "UPDATE " + tableName + " SET cache_value = ?, tags = ?, created_at = ?, expires_at = ? WHERE cache_key = ?",
                    entry.getValue(), tags, createdAt, expires, entry.getKey());
        }
    }

    private void recordAccess(List<String> keys) {
        namedJdbcTemplate.update(
                "UPDATE " + tableName + " SET access_count = access_count + 1, last_accessed_at = :now"
                        + " WHERE cache_key IN (:keys)",
                new MapSqlParameterSource()
                        .addValue("now", Timestamp.from(clock.instant()))
                        .addValue("keys", keys));
    }

    private Set<String> deleteKeys(List<String> keys) {
        Set<String> deleted = new LinkedHashSet<>();
        for (int start = 0; start < keys.size(); start += IN_CLAUSE_BATCH_SIZE) {
            List<String> batch = keys.subList(start, Math.min(start + IN_CLAUSE_BATCH_SIZE, keys.size()));
            namedJdbcTemplate.update(
                    "DELETE FROM " + tableName + " WHERE cache_key IN (:keys)",
                    new MapSqlParameterSource("keys", batch));
            deleted.addAll(batch);
        }
        return deleted;
    }

    private Instant resolveExpiresAt(TierEntry entry, Duration ttl) {
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            return clock.instant().plus(ttl);
        }
        return entry.getExpiresAt();
    }

    private static String tagCondition(Collection<String> tags, MapSqlParameterSource params) {
        List<String> clauses = new ArrayList<>(tags.size());
        int index = 0;
        for (String tag : tags) {
            String name = "tag" + index++;
            params.addValue(name, "%," + escapeLike(tag) + ",%");
            clauses.add("CONCAT(',', tags, ',') LIKE :" + name + " ESCAPE '" + LIKE_ESCAPE + "'");
        }
        return String.join(" OR ", clauses);
    }

    /**
     * glob（{@code *}、{@code ?}）转换为 LIKE 模式
     */
    static String globToLike(String glob) {
        StringBuilder like = new StringBuilder(glob.length() + 4);
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> like.append('%');
                case '?' -> like.append('_');
                case '%', '_', LIKE_ESCAPE -> like.append(LIKE_ESCAPE).append(c);
                default -> like.append(c);
            }
        }
        return like.toString();
    }

    private static String escapeLike(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    static String joinTags(Set<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        return String.join(",", new TreeSet<>(tags));
    }

    static Set<String> splitTags(String tags) {
        if (!StringUtils.hasText(tags)) {
            return Collections.emptySet();
        }
        return new LinkedHashSet<>(Arrays.asList(StringUtils.tokenizeToStringArray(tags, ",")));
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new CacheTierException(NAME, "JDBC " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
