/**
 * WorkerMain.java
 *
 * 工作进程入口，由 JvmWorkerLauncher 以独立 JVM 启动，不创建 Spring 上下文。
 * 真实的 stdout 专用于协议帧，System.out 被重定向到 stderr，日志同样写到 stderr（kernel-worker-logback.xml）。
 */
package club.ppmc.kernel.worker;

import club.ppmc.kernel.protocol.IpcCodec;
import java.io.BufferedOutputStream;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class WorkerMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerMain.class);

    private WorkerMain() {}

    public static void main(String[] args) {
        OutputStream protocolOut = new BufferedOutputStream(new FileOutputStream(FileDescriptor.out));
        System.setOut(System.err);

        int workerId = Integer.getInteger("kernel.worker.id", 0);
        var options = new RuntimeOptions(
                Path.of(System.getProperty("kernel.worker.workspace", "workspace")),
                Long.getLong("kernel.worker.batch-ms", RuntimeOptions.DEFAULT_BATCH_MS),
                System.getProperty("kernel.worker.npm", "npm"),
                Long.getLong("kernel.worker.default-timeout-ms", RuntimeOptions.DEFAULT_TIMEOUT_MS));
        int maxFrameBytes = Integer.getInteger("kernel.worker.max-frame-bytes", 5_000_000);

        LOGGER.info("工作进程 worker-{} 启动，工作区: {}", workerId, options.workspaceRoot().toAbsolutePath());
        int exitCode = 0;
        try (var server = new WorkerServer(System.in, protocolOut, options, maxFrameBytes, new IpcCodec())) {
            server.serve();
        } catch (IOException e) {
            LOGGER.error("工作进程 worker-{} 协议读取失败", workerId, e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }
}
