/**
 * PoolStats.java
 *
 * 工作池的瞬时统计，供 REST 接口与监控使用。
 */
package club.ppmc.kernel.model;

public record PoolStats(int size, int idle, int busy, int crashed, int reserved, int active, int queued) {}
