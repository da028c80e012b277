package io.github.davidhlp.spring.cache.tiered.serialization;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.impl.LaissezFaireSubTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * 缓存值编解码器
 *
 * <p>值以带类型信息的 JSON 存入远程层，超过阈值或显式要求时使用 gzip 压缩。
 * 解码时通过 gzip 魔数识别压缩数据，对调用方透明。
 */
@Slf4j
public class ValueCodec {

    private static final byte GZIP_MAGIC_FIRST = (byte) 0x1f;
    private static final byte GZIP_MAGIC_SECOND = (byte) 0x8b;

    @Getter private final ObjectMapper objectMapper;

    private final GenericJackson2JsonRedisSerializer serializer;

    /** 自动压缩阈值（字节） */
    @Getter private final int compressionThreshold;

    public ValueCodec(int compressionThreshold) {
        this(createObjectMapper(), compressionThreshold);
    }

    public ValueCodec(ObjectMapper objectMapper, int compressionThreshold) {
        this.objectMapper = objectMapper;
        this.serializer = new GenericJackson2JsonRedisSerializer(objectMapper);
        this.compressionThreshold = compressionThreshold;
    }

    /** 支持 JavaTime 并保留类型信息的 ObjectMapper */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.activateDefaultTyping(
                LaissezFaireSubTypeValidator.instance,
                ObjectMapper.DefaultTyping.NON_FINAL,
                JsonTypeInfo.As.PROPERTY);
        return objectMapper;
    }

    /**
     * 序列化对象，必要时压缩
     *
     * @param value 待序列化的对象，不能为 null
     * @param forceCompress 是否强制尝试压缩
     * @return 编码结果；压缩后不更小时保留原始字节
     */
    public EncodedValue encode(Object value, boolean forceCompress) {
        byte[] raw = serialize(value);
        if (!forceCompress && raw.length <= compressionThreshold) {
            return new EncodedValue(raw, raw.length, false);
        }

        byte[] compressed = compress(raw);
        if (compressed.length < raw.length) {
            if (log.isDebugEnabled()) {
                log.debug("Compressed cache value: rawSize={}, compressedSize={}", raw.length, compressed.length);
            }
            return new EncodedValue(compressed, raw.length, true);
        }
        return new EncodedValue(raw, raw.length, false);
    }

    /**
     * 反序列化，自动识别 gzip 数据
     *
     * @param data 远程层读取的字节
     * @return 对象，data 为空时返回 null
     * @throws SerializationException 数据损坏或无法反序列化
     */
    public Object decode(byte[] data) {
        if (data == null || data.length == 0) {
            return null;
        }
        byte[] raw = isCompressed(data) ? decompress(data) : data;
        try {
            return serializer.deserialize(raw);
        } catch (RuntimeException e) {
            throw new SerializationException("Failed to deserialize cache value: " + e.getMessage(), e);
        }
    }

    public byte[] serialize(Object value) {
        if (value == null) {
            throw new SerializationException("Cannot serialize null value");
        }
        try {
            return serializer.serialize(value);
        } catch (RuntimeException e) {
            throw new SerializationException(
                    "Failed to serialize value of type " + value.getClass().getName() + ": " + e.getMessage(), e);
        }
    }

    public static boolean isCompressed(byte[] data) {
        return data != null && data.length >= 2 && data[0] == GZIP_MAGIC_FIRST && data[1] == GZIP_MAGIC_SECOND;
    }

    static byte[] compress(byte[] raw) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream();
                GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(raw);
            gzip.finish();
            return out.toByteArray();
        } catch (IOException e) {
            throw new SerializationException("Failed to compress cache value", e);
        }
    }

    static byte[] decompress(byte[] compressed) {
        try (ByteArrayInputStream in = new ByteArrayInputStream(compressed);
                GZIPInputStream gzip = new GZIPInputStream(in)) {
            return gzip.readAllBytes();
        } catch (IOException e) {
            throw new SerializationException("Failed to decompress cache value", e);
        }
    }
}
