package com.mudhub.realtime.janitor;

/**
 * 堆内存使用率探针（0.0 ~ 1.0）。
 */
@FunctionalInterface
public interface MemoryProbe {

    double usageRatio();

    /** 基于 {@link Runtime} 的默认实现：已用 / 最大堆 */
    static MemoryProbe runtime() {
        return () -> {
            Runtime rt = Runtime.getRuntime();
            long used = rt.totalMemory() - rt.freeMemory();
            return (double) used / rt.maxMemory();
        };
    }
}
