package com.realestate.cache.warmup;

import java.util.List;

/**
 * 预热汇总
 */
public record WarmupReport(int total, int warmed, int alreadyCached, int errors, List<WarmupItemResult> results) {

    public static WarmupReport of(List<WarmupItemResult> results) {
        int warmed = 0;
        int alreadyCached = 0;
        int errors = 0;
        for (WarmupItemResult result : results) {
            switch (result.status()) {
                case WARMED -> warmed++;
                case ALREADY_CACHED -> alreadyCached++;
                case ERROR -> errors++;
                default -> {
                    // NO_FETCH_FUNCTION 只计入 total
                }
            }
        }
        return new WarmupReport(results.size(), warmed, alreadyCached, errors, List.copyOf(results));
    }
}
