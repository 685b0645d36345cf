package com.realestate.cache.dto;

import java.util.List;

/**
 * 单 Key 驱逐结果
 *
 * @param volatileDeleted 易失层删除是否成功执行
 * @param durableDeleted  持久层是否确实删除了条目
 * @param errors          层故障描述
 */
public record CacheEviction(String key, boolean volatileDeleted, boolean durableDeleted, List<String> errors) {

    public CacheEviction {
        errors = List.copyOf(errors);
    }
}
