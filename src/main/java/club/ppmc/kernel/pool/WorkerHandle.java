/**
 * WorkerHandle.java
 *
 * 编排器一侧对单个工作进程的封装：写 CONTROL 帧、在独立线程上读取输出帧、
 * 把工作进程的 stderr 转入应用日志，并在进程退出且输出读完之后通知工作池。
 */
package club.ppmc.kernel.pool;

import club.ppmc.kernel.model.WorkerSnapshot;
import club.ppmc.kernel.protocol.Frame;
import club.ppmc.kernel.protocol.FrameKind;
import club.ppmc.kernel.protocol.FrameProtocolException;
import club.ppmc.kernel.protocol.FrameReader;
import club.ppmc.kernel.protocol.FrameWriter;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

@Slf4j
final class WorkerHandle {

    private final int id;
    private final WorkerProcess process;
    private final ReservedWorker reservation;
    private final WorkerPool pool;
    private final FrameWriter writer;
    private final long startedAt = System.currentTimeMillis();

    private volatile boolean busy;
    private volatile boolean crashed;
    private volatile ActiveJob currentJob;

    WorkerHandle(int id, WorkerProcess process, ReservedWorker reservation, WorkerPool pool) {
        this.id = id;
        this.process = process;
        this.reservation = reservation;
        this.pool = pool;
        this.writer = new FrameWriter(process.stdin());
    }

    /**
     * 启动读取线程，并在进程退出、且输出流被完全读取后通知工作池。
     */
    void start(int maxFrameBytes) {
        CompletableFuture<Void> readerDone = new CompletableFuture<>();
        startDaemon("worker-" + id + "-reader", () -> {
            try {
                readFrames(maxFrameBytes);
            } finally {
                readerDone.complete(null);
            }
        });
        startDaemon("worker-" + id + "-stderr", this::drainStderr);

        // 进程退出后最多再等 1 秒让读取线程读完剩余的帧
        process.onExit()
                .thenCompose(code -> readerDone.completeOnTimeout(null, 1, TimeUnit.SECONDS).thenApply(v -> code))
                .thenAccept(code -> pool.onWorkerExit(this, code));
    }

    private void readFrames(int maxFrameBytes) {
        var reader = new FrameReader(process.stdout(), maxFrameBytes);
        try {
            Frame frame;
            while ((frame = reader.next()) != null) {
                pool.onFrame(this, frame);
            }
        } catch (FrameProtocolException e) {
            pool.onProtocolError(this, e);
        } catch (IOException e) {
            if (!crashed) {
                log.warn("读取 worker-{} 输出时出错: {}", id, e.getMessage());
            }
        }
    }

    private void drainStderr() {
        try (var reader = new BufferedReader(new InputStreamReader(process.stderr(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.info("[worker-{}] {}", id, line);
            }
        } catch (IOException e) {
            log.debug("worker-{} 的 stderr 已关闭: {}", id, e.getMessage());
        }
    }

    private static void startDaemon(String name, Runnable task) {
        var thread = new Thread(task, name);
        thread.setDaemon(true);
        thread.start();
    }

    void send(byte[] controlPayload) throws IOException {
        writer.write(FrameKind.CONTROL, controlPayload);
    }

    /** 标记为已崩溃并强制终止进程。 */
    void kill() {
        crashed = true;
        process.kill();
    }

    void markCrashed() {
        crashed = true;
    }

    void attach(ActiveJob job) {
        this.currentJob = job;
    }

    void detach(ActiveJob job) {
        if (currentJob == job) {
            currentJob = null;
        }
    }

    ActiveJob currentJob() {
        return currentJob;
    }

    int id() {
        return id;
    }

    long pid() {
        return process.pid();
    }

    boolean isBusy() {
        return busy;
    }

    void setBusy(boolean busy) {
        this.busy = busy;
    }

    boolean isCrashed() {
        return crashed;
    }

    boolean isReserved() {
        return reservation != null;
    }

    ReservedWorker reservation() {
        return reservation;
    }

    long uptimeMs() {
        return System.currentTimeMillis() - startedAt;
    }

    WorkerSnapshot snapshot() {
        ActiveJob job = currentJob;
        return new WorkerSnapshot(id, process.pid(), isReserved(), busy, crashed, job == null ? null : job.jobId());
    }
}
