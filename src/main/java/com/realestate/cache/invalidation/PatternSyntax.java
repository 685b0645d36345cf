package com.realestate.cache.invalidation;

/**
 * 失效模式语法
 */
public enum PatternSyntax {
    /** 正则，大小写不敏感，按子串匹配（find） */
    REGEX,
    /** 通配符，* 匹配任意字符串，? 匹配单个字符，需匹配整个 Key */
    GLOB
}
