/**
 * WorkerProcess.java
 *
 * 工作池眼中的一个工作进程：三条标准流、退出通知和强制终止。
 * 生产环境下由 JvmWorkerLauncher 提供真实的子进程实现。
 */
package club.ppmc.kernel.pool;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

public interface WorkerProcess {

    long pid();

    /** 编排器写入 CONTROL 帧的通道。 */
    OutputStream stdin();

    /** 工作进程输出的帧流。 */
    InputStream stdout();

    /** 工作进程自身的日志。 */
    InputStream stderr();

    /** 进程退出时以退出码完成。 */
    CompletableFuture<Integer> onExit();

    boolean isAlive();

    /** 强制终止进程（连同其子进程）。 */
    void kill();
}
