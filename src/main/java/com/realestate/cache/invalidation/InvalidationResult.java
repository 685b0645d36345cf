package com.realestate.cache.invalidation;

import java.util.List;

/**
 * 失效结果
 *
 * @param volatileDeleted 易失层删除条数
 * @param durableDeleted  持久层删除条数
 * @param volatileSkipped 请求了易失层但未执行（模式失效不支持易失层）
 * @param errors          层故障描述
 */
public record InvalidationResult(int volatileDeleted, int durableDeleted, boolean volatileSkipped, List<String> errors) {

    public InvalidationResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
