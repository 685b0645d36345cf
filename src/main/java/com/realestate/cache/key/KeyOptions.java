package com.realestate.cache.key;

/**
 * Key 生成选项
 *
 * @param prefix           覆盖默认前缀，null 表示使用配置的默认值
 * @param userSpecific     是否按用户隔离
 * @param userId           用户 ID，仅在 userSpecific 时生效
 * @param includeTimestamp 是否附加小时时间桶
 */
public record KeyOptions(String prefix, boolean userSpecific, String userId, boolean includeTimestamp) {

    private static final KeyOptions DEFAULTS = new KeyOptions(null, false, null, false);

    public static KeyOptions defaults() {
        return DEFAULTS;
    }

    public static KeyOptions forUser(String userId) {
        return new KeyOptions(null, true, userId, false);
    }

    public KeyOptions withPrefix(String newPrefix) {
        return new KeyOptions(newPrefix, userSpecific, userId, includeTimestamp);
    }

    public KeyOptions withTimestamp() {
        return new KeyOptions(prefix, userSpecific, userId, true);
    }
}
