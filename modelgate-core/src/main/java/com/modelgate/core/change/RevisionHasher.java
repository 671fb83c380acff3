package com.modelgate.core.change;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.modelgate.api.exception.ModelGateException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * revision 计算
 * <p>
 * revision = hex(digest(规范 JSON))，规范 JSON 的键按字典序排列且省略 null 值，
 * 因此字段顺序不同或某字段显式为 null 的两个实体得到相同的 revision。
 * </p>
 */
public class RevisionHasher {

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    private final String algorithm;

    public RevisionHasher(String algorithm) {
        this.algorithm = algorithm == null ? "SHA-1" : algorithm;
        // 提前校验算法名
        newDigest();
    }

    public String hash(String value) {
        byte[] digest = newDigest().digest(value.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest);
    }

    public String revisionFor(Map<String, Object> instance) {
        if (instance == null) {
            throw new IllegalArgumentException("revisionFor() requires an instance");
        }
        return hash(canonicalJson(instance));
    }

    public String canonicalJson(Map<String, Object> instance) {
        try {
            return mapper.writeValueAsString(canonicalize(instance));
        } catch (JsonProcessingException e) {
            throw new ModelGateException("Cannot serialize instance for revision: " + e.getMessage(), e);
        }
    }

    private static Object canonicalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> {
                if (v != null) {
                    sorted.put(String.valueOf(k), canonicalize(v));
                }
            });
            return sorted;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(canonicalize(item));
            }
            return copy;
        }
        return value;
    }

    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unknown hash algorithm: " + algorithm, e);
        }
    }
}
