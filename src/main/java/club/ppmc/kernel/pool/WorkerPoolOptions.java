/**
 * WorkerPoolOptions.java
 *
 * 工作池的可调参数。未设置的项取默认值，默认值与 KernelSettings 的初始值一致。
 */
package club.ppmc.kernel.pool;

import club.ppmc.kernel.model.KernelSettings;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class WorkerPoolOptions {

    /** 共享工作进程数，默认 min(2, CPU核数)，至少为 1。 */
    @Builder.Default int size = defaultSize();

    /** 每个工作进程的堆上限（MB）。 */
    @Builder.Default int memoryMb = 256;

    @Builder.Default long perJobTimeoutMs = 10_000;

    /** 单个作业允许产生的流式输出字节数（按编码后的帧计算）。 */
    @Builder.Default long maxOutputBytes = 5_000_000;

    /** 工作进程刷新控制台输出缓冲的间隔。 */
    @Builder.Default long batchMs = 25;

    /** 发送 Cancel 后等待工作进程自行结束的时间，超过则强制终止。 */
    @Builder.Default long cancelGraceMs = 250;

    /** 编排器看门狗在作业超时之外额外等待的时间。 */
    @Builder.Default long watchdogSlackMs = 5_000;

    /** 工作进程的沙箱根目录。 */
    @Builder.Default Path workspaceRoot = Paths.get("./workspace", "workers");

    public static WorkerPoolOptions defaults() {
        return builder().build();
    }

    public static WorkerPoolOptions from(KernelSettings settings) {
        return builder()
                .size(settings.getPoolSize() > 0 ? settings.getPoolSize() : defaultSize())
                .memoryMb(settings.getMemoryMb())
                .perJobTimeoutMs(settings.getPerJobTimeoutMs())
                .maxOutputBytes(settings.getMaxOutputBytes())
                .batchMs(settings.getBatchMs())
                .cancelGraceMs(settings.getCancelGraceMs())
                .watchdogSlackMs(settings.getWatchdogSlackMs())
                .workspaceRoot(Paths.get(settings.getWorkspaceRoot(), "workers").toAbsolutePath().normalize())
                .build();
    }

    static int defaultSize() {
        return Math.max(1, Math.min(2, Runtime.getRuntime().availableProcessors()));
    }
}
