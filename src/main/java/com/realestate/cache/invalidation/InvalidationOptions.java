package com.realestate.cache.invalidation;

/**
 * @param includeVolatile 是否请求清理易失层（目前不支持按模式清理，只在结果中标记跳过）
 * @param includeDurable  是否清理持久层
 * @param syntax          模式语法
 */
public record InvalidationOptions(boolean includeVolatile, boolean includeDurable, PatternSyntax syntax) {

    public InvalidationOptions {
        if (syntax == null) {
            syntax = PatternSyntax.REGEX;
        }
    }

    public static InvalidationOptions defaults() {
        return new InvalidationOptions(true, true, PatternSyntax.REGEX);
    }

    public static InvalidationOptions glob() {
        return new InvalidationOptions(true, true, PatternSyntax.GLOB);
    }

    public InvalidationOptions durableOnly() {
        return new InvalidationOptions(false, true, syntax);
    }
}
