/**
 * WorkerSnapshot.java
 *
 * 单个工作进程的状态快照。
 */
package club.ppmc.kernel.model;

/**
 * @param workerId 工作进程编号（日志前缀 worker-N 中的 N）。
 * @param pid 操作系统进程号。
 * @param reserved 是否为会话独占的工作进程。
 * @param busy 是否正在执行作业。
 * @param crashed 是否已退出或被强制终止。
 * @param currentJobId 正在执行的作业ID，空闲时为 null。
 */
public record WorkerSnapshot(
        int workerId, long pid, boolean reserved, boolean busy, boolean crashed, String currentJobId) {}
