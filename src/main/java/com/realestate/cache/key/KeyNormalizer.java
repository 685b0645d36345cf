package com.realestate.cache.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.realestate.cache.config.CacheProperties;
import com.realestate.cache.constant.CacheConstants;
import com.realestate.cache.exception.NormalizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 缓存 Key 规范化器
 *
 * 规范化规则：
 * 1. 字符串去首尾空白并转小写，空串丢弃
 * 2. 数值统一为规范形式（整数值为 Long），布尔原样保留（NaN / Infinity 视为非法）
 * 3. 集合与数组：元素逐个规范化后排序（按元素的规范 JSON 排序）
 * 4. 嵌套 Map 递归规范化，各层 Key 均按字母序排列
 * 5. null 值丢弃
 *
 * 哈希为规范 JSON 的 MD5 截断（默认 8 位十六进制，即 32 bit）。
 * 语义不同的参数以极高概率得到不同 Key，但截断哈希并非无碰撞，
 * 持久层会校验完整参数来拦截碰撞（见 DurableTier#findByParams）。
 */
@Component
public class KeyNormalizer {

    private static final Logger log = LoggerFactory.getLogger(KeyNormalizer.class);

    private static final int MAX_HASH_LENGTH = 32;

    private final ObjectMapper canonicalMapper;
    private final Clock clock;
    private final String defaultPrefix;
    private final int hashLength;

    @Autowired
    public KeyNormalizer(ObjectMapper objectMapper, Clock clock, CacheProperties cacheProperties) {
        this(objectMapper, clock, cacheProperties.getKey().getPrefix(), cacheProperties.getKey().getHashLength());
    }

    public KeyNormalizer(ObjectMapper objectMapper, Clock clock, String defaultPrefix, int hashLength) {
        if (hashLength < 1 || hashLength > MAX_HASH_LENGTH) {
            throw new IllegalArgumentException("hashLength must be within [1, 32]: " + hashLength);
        }
        this.canonicalMapper = objectMapper.copy()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
        this.defaultPrefix = defaultPrefix;
        this.hashLength = hashLength;
    }

    public GeneratedKey generateKey(String type, Map<String, ?> params) {
        return generateKey(type, params, KeyOptions.defaults());
    }

    /**
     * 生成缓存 Key
     *
     * @throws NormalizationException 类型或参数不合法
     */
    public GeneratedKey generateKey(String type, Map<String, ?> params, KeyOptions options) {
        String normalizedType = normalizeType(type);
        if (params == null) {
            throw new NormalizationException("Cache params must not be null for type " + normalizedType);
        }
        KeyOptions opts = options == null ? KeyOptions.defaults() : options;

        Map<String, Object> normalized = Collections.unmodifiableMap(normalize(params));
        String canonical = toCanonicalJson(normalized);
        String hash = hash(canonical);

        Map<String, String> tags = new LinkedHashMap<>();
        if (opts.userSpecific() && opts.userId() != null && !opts.userId().isBlank()) {
            tags.put(CacheConstants.USER_TAG, opts.userId().trim());
        }
        if (opts.includeTimestamp()) {
            long hourBucket = Math.floorDiv(clock.millis(), CacheConstants.HOUR_BUCKET_MILLIS);
            tags.put(CacheConstants.TIME_BUCKET_TAG, Long.toString(hourBucket));
        }

        String prefix = opts.prefix() != null ? opts.prefix() : defaultPrefix;
        CacheKey cacheKey = new CacheKey(prefix == null || prefix.isBlank() ? null : prefix.trim(),
            normalizedType, hash, tags);
        String rendered = cacheKey.render();

        log.debug("Generated cache key: {} params={}", rendered, canonical);
        return new GeneratedKey(rendered, cacheKey, normalized, canonical);
    }

    /**
     * 规范化参数 Map，返回按 Key 排序的新 Map
     */
    public TreeMap<String, Object> normalize(Map<?, ?> params) {
        TreeMap<String, Object> result = new TreeMap<>();
        for (Map.Entry<?, ?> entry : params.entrySet()) {
            if (!(entry.getKey() instanceof String name)) {
                throw new NormalizationException("Cache param names must be strings, got: " + entry.getKey());
            }
            Object value = normalizeValue(name, entry.getValue());
            if (value != null) {
                result.put(name, value);
            }
        }
        return result;
    }

    private Object normalizeValue(String path, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof CharSequence text) {
            String normalized = text.toString().trim().toLowerCase(Locale.ROOT);
            return normalized.isEmpty() ? null : normalized;
        }
        if (value instanceof Enum<?> constant) {
            return constant.name().toLowerCase(Locale.ROOT);
        }
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number number) {
            return normalizeNumber(path, number);
        }
        if (value instanceof Map<?, ?> nested) {
            return normalize(nested);
        }
        if (value instanceof Collection<?> collection) {
            return normalizeElements(path, new ArrayList<>(collection));
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return normalizeElements(path, elements);
        }
        throw new NormalizationException("Unsupported value type for param '" + path + "': "
            + value.getClass().getName());
    }

    /**
     * 数值统一为规范形式：整数值为 Long（超出范围为 BigInteger），其余为去尾零的 BigDecimal。
     * 300000、300000.0 与 new BigDecimal("3.0E+5") 得到同一个 Key
     */
    private Number normalizeNumber(String path, Number number) {
        if (number instanceof Double d && (d.isNaN() || d.isInfinite())) {
            throw new NormalizationException("Non-finite number for param '" + path + "'");
        }
        if (number instanceof Float f && (f.isNaN() || f.isInfinite())) {
            throw new NormalizationException("Non-finite number for param '" + path + "'");
        }
        if (number instanceof Long || number instanceof Integer
            || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        BigDecimal decimal = toBigDecimal(path, number).stripTrailingZeros();
        if (decimal.scale() <= 0) {
            BigInteger integral = decimal.toBigIntegerExact();
            return integral.bitLength() < Long.SIZE ? (Number) integral.longValue() : integral;
        }
        return decimal;
    }

    private static BigDecimal toBigDecimal(String path, Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double d) {
            return BigDecimal.valueOf(d);
        }
        try {
            // Float 走 toString，避免二进制展开（0.1f -> 0.100000001...）
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            throw new NormalizationException("Unsupported number for param '" + path + "': " + number, e);
        }
    }

    private List<Object> normalizeElements(String path, List<Object> elements) {
        List<Object> normalized = new ArrayList<>(elements.size());
        for (Object element : elements) {
            Object value = normalizeValue(path, element);
            if (value != null) {
                normalized.add(value);
            }
        }
        // 混合类型无自然序，统一按规范 JSON 排序
        normalized.sort(Comparator.comparing(this::toCanonicalJson));
        return Collections.unmodifiableList(normalized);
    }

    private String normalizeType(String type) {
        if (type == null || type.isBlank()) {
            throw new NormalizationException("Cache type must not be blank");
        }
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        if (normalized.contains(CacheConstants.KEY_SEPARATOR)) {
            throw new NormalizationException("Cache type must not contain '"
                + CacheConstants.KEY_SEPARATOR + "': " + type);
        }
        return normalized;
    }

    private String toCanonicalJson(Object value) {
        try {
            return canonicalMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new NormalizationException("Cache params cannot be serialized", e);
        }
    }

    private String hash(String canonical) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, hashLength);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
