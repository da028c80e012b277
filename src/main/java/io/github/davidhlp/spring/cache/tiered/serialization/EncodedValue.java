package io.github.davidhlp.spring.cache.tiered.serialization;

/**
 * 编码结果
 *
 * @param bytes 写入远程层的字节（可能已压缩）
 * @param rawSize 未压缩的序列化大小
 * @param compressed bytes 是否为 gzip 格式
 */
public record EncodedValue(byte[] bytes, int rawSize, boolean compressed) {}
