package com.realestate.cache.key;

import com.realestate.cache.constant.CacheConstants;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * 结构化缓存 Key
 * 渲染格式：[prefix:]type:hash[:user:&lt;id&gt;][:t:&lt;hourBucket&gt;]
 *
 * @param prefix 可选前缀，null 表示无
 * @param type   数据类别
 * @param hash   规范化参数的截断哈希
 * @param tags   有序标签（user、t）
 */
public record CacheKey(String prefix, String type, String hash, Map<String, String> tags) {

    public CacheKey {
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    /**
     * 渲染为字符串形式，各层均以该值作为主键
     */
    public String render() {
        StringJoiner joiner = new StringJoiner(CacheConstants.KEY_SEPARATOR);
        if (prefix != null && !prefix.isEmpty()) {
            joiner.add(prefix);
        }
        joiner.add(type).add(hash);
        tags.forEach((name, value) -> joiner.add(name).add(value));
        return joiner.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
