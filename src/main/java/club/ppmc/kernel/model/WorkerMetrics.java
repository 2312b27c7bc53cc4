/**
 * WorkerMetrics.java
 *
 * 推送到 /topic/kernel/workers 的工作进程资源指标。
 */
package club.ppmc.kernel.model;

import java.util.List;

public record WorkerMetrics(PoolStats pool, List<ProcessUsage> workers, long timestamp) {

    /**
     * @param cpuLoad 两次采样之间的 CPU 使用率（百分比）。
     * @param residentBytes 常驻内存字节数。
     */
    public record ProcessUsage(int workerId, long pid, boolean busy, double cpuLoad, long residentBytes) {}
}
