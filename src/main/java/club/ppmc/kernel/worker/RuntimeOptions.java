package club.ppmc.kernel.worker;

import java.nio.file.Path;

/**
 * 工作进程内运行时的配置，由 WorkerMain 从系统属性读取。
 *
 * @param workspaceRoot 该工作进程的工作区，笔记本沙箱目录位于其下。
 * @param batchMs 控制台输出的刷新间隔。
 * @param npmCommand 安装依赖时使用的 npm 命令。
 * @param defaultTimeoutMs 消息未携带超时时间时使用的默认值。
 */
public record RuntimeOptions(Path workspaceRoot, long batchMs, String npmCommand, long defaultTimeoutMs) {

    public static final long DEFAULT_BATCH_MS = 25;
    public static final long DEFAULT_TIMEOUT_MS = 10_000;

    public RuntimeOptions {
        batchMs = batchMs > 0 ? batchMs : DEFAULT_BATCH_MS;
        npmCommand = npmCommand == null || npmCommand.isBlank() ? "npm" : npmCommand;
        defaultTimeoutMs = defaultTimeoutMs > 0 ? defaultTimeoutMs : DEFAULT_TIMEOUT_MS;
    }

    public static RuntimeOptions of(Path workspaceRoot) {
        return new RuntimeOptions(workspaceRoot, DEFAULT_BATCH_MS, "npm", DEFAULT_TIMEOUT_MS);
    }
}
