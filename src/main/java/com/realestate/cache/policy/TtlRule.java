package com.realestate.cache.policy;

/**
 * 单个数据类别解析后的策略
 *
 * @param type              数据类别名
 * @param volatileSeconds   易失层 TTL（已应用上限）
 * @param durableSeconds    持久层 TTL
 * @param durableEligible   是否写入持久层
 * @param estimatedUnitCost 单次上游调用估算成本
 */
public record TtlRule(String type,
                      long volatileSeconds,
                      long durableSeconds,
                      boolean durableEligible,
                      double estimatedUnitCost) {
}
