/**
 * KernelSettings.java
 *
 * 内核服务的可持久化配置。由 SettingsService 负责加载和保存到工作区的 .kernel/settings.json 文件中。
 * 它是一个可变对象，以便于Jackson库进行序列化和反序列化。
 */
package club.ppmc.kernel.model;

import java.util.Objects;
import lombok.Data;

@Data
public class KernelSettings {

    /**
     * 工作区根目录。每个工作进程在其下的 workers/ 子目录中为笔记本创建沙箱。
     */
    private String workspaceRoot = "./workspace";

    // --- 工作池 ---
    /** 共享工作进程的数量，0 表示按 CPU 核数取 min(2, cpus)。 */
    private int poolSize = 0;

    private int memoryMb = 256;
    private long perJobTimeoutMs = 10_000;
    private long maxOutputBytes = 5_000_000;
    private long batchMs = 25;
    private long cancelGraceMs = 250;
    private long watchdogSlackMs = 5_000;

    /** 启动工作进程所用的 java 可执行文件，为空时使用当前 JVM 的。 */
    private String javaExecutable;

    /** 安装笔记本依赖时使用的 npm 命令。 */
    private String npmCommand = "npm";

    /**
     * 除单作业超时外，工作池与工作进程的参数只在启动时读取。
     *
     * @return 与 previous 相比，是否有需要重启才能生效的修改。
     */
    public boolean requiresRestartComparedTo(KernelSettings previous) {
        return poolSize != previous.poolSize
                || memoryMb != previous.memoryMb
                || maxOutputBytes != previous.maxOutputBytes
                || batchMs != previous.batchMs
                || cancelGraceMs != previous.cancelGraceMs
                || watchdogSlackMs != previous.watchdogSlackMs
                || !Objects.equals(javaExecutable, previous.javaExecutable)
                || !Objects.equals(npmCommand, previous.npmCommand);
    }
}
