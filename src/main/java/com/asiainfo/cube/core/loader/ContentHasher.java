package com.asiainfo.cube.core.loader;

import com.asiainfo.cube.core.CubeConstants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * 内容哈希（行标识）
 * 编码规则固定为：版本前缀 + 换行 + 键按字典序排序的 JSON（递归），再取 SHA-1 十六进制（40 位）。
 * 相同逻辑内容无论键顺序如何，得到的标识都相同。
 */
public final class ContentHasher {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private ContentHasher() {}

    public static String hash(Object content) {
        return DigestUtils.sha1Hex(canonical(content).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 规范化编码，便于排查哈希不一致
     */
    public static String canonical(Object content) {
        try {
            return CubeConstants.HASH_VERSION + "\n" + CANONICAL.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Content cannot be canonicalized: " + content, e);
        }
    }
}
