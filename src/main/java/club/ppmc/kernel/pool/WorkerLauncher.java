package club.ppmc.kernel.pool;

import club.ppmc.kernel.exception.WorkerSpawnException;

/**
 * 启动新的工作进程。
 */
@FunctionalInterface
public interface WorkerLauncher {

    /**
     * @param workerId 工作池分配的编号，用于日志前缀和沙箱目录名。
     * @throws WorkerSpawnException 进程无法启动。
     */
    WorkerProcess launch(int workerId, WorkerPoolOptions options);
}
