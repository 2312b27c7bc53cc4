/**
 * WorkerServer.java
 *
 * 工作进程的协议循环。主线程从 stdin 逐帧读取控制消息，作业交给唯一的执行线程运行，
 * 取消请求则在读取线程上直接作用于当前作业的 CancellationToken。
 * 所有输出帧（流式输出、Ack、Result、Error）经同一个 FrameWriter 写到 stdout，帧之间不会交错。
 */
package club.ppmc.kernel.worker;

import club.ppmc.kernel.model.ExecutionResult;
import club.ppmc.kernel.protocol.AckMessage;
import club.ppmc.kernel.protocol.CancelMessage;
import club.ppmc.kernel.protocol.ErrorMessage;
import club.ppmc.kernel.protocol.Frame;
import club.ppmc.kernel.protocol.FrameKind;
import club.ppmc.kernel.protocol.FrameReader;
import club.ppmc.kernel.protocol.FrameWriter;
import club.ppmc.kernel.protocol.InvokeHandlerMessage;
import club.ppmc.kernel.protocol.IpcCodec;
import club.ppmc.kernel.protocol.IpcMessage;
import club.ppmc.kernel.protocol.ResultMessage;
import club.ppmc.kernel.protocol.RunCellMessage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class WorkerServer implements AutoCloseable {

    private record RunningJob(String jobId, CancellationToken token) {}

    private final InputStream in;
    private final FrameWriter writer;
    private final int maxFrameBytes;
    private final IpcCodec codec;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService executor;
    private final NotebookRuntime runtime;
    private final AtomicBoolean outputBroken = new AtomicBoolean();
    private final Object jobLock = new Object();
    private RunningJob current;

    public WorkerServer(InputStream in, OutputStream out, RuntimeOptions options, int maxFrameBytes, IpcCodec codec) {
        this.in = in;
        this.writer = new FrameWriter(out);
        this.maxFrameBytes = maxFrameBytes;
        this.codec = codec;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemon("kernel-worker-timer"));
        this.executor = Executors.newSingleThreadExecutor(daemon("kernel-exec"));
        this.runtime = new NotebookRuntime(options, this::sendFrame, scheduler, codec.objectMapper());
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * 读取并处理控制消息，直到 stdin 关闭。
     *
     * @throws IOException 帧格式错误或读取失败。
     */
    public void serve() throws IOException {
        var reader = new FrameReader(in, maxFrameBytes);
        Frame frame;
        while ((frame = reader.next()) != null) {
            if (frame.kind() != FrameKind.CONTROL) {
                log.debug("忽略发往工作进程的 {} 帧", frame.kind());
                continue;
            }
            Optional<IpcMessage> message = codec.decode(frame.payload());
            message.ifPresent(this::handle);
        }
        log.info("stdin 已关闭，工作进程退出");
    }

    void handle(IpcMessage message) {
        if (message instanceof CancelMessage cancel) {
            onCancel(cancel.jobId());
        } else if (message instanceof RunCellMessage || message instanceof InvokeHandlerMessage) {
            submit(message);
        } else {
            log.debug("忽略工作进程不处理的消息: {}", message.getClass().getSimpleName());
        }
    }

    private void onCancel(String jobId) {
        RunningJob job;
        synchronized (jobLock) {
            job = current;
        }
        if (job != null && job.jobId().equals(jobId)) {
            log.info("取消作业 {}", jobId);
            job.token().cancel();
        } else {
            log.debug("收到未知作业 {} 的取消请求", jobId);
        }
    }

    private void submit(IpcMessage message) {
        RunningJob job;
        synchronized (jobLock) {
            if (current != null) {
                send(new ErrorMessage(message.jobId(), "WorkerBusy",
                        "Worker is busy with job " + current.jobId(), null));
                return;
            }
            job = new RunningJob(message.jobId(), new CancellationToken());
            current = job;
        }
        executor.execute(() -> run(message, job));
    }

    private void run(IpcMessage message, RunningJob job) {
        send(new AckMessage(job.jobId()));
        IpcMessage reply;
        try {
            ExecutionResult result = message instanceof RunCellMessage runCell
                    ? runtime.runCell(runCell, job.token())
                    : runtime.invokeHandler((InvokeHandlerMessage) message, job.token());
            reply = ResultMessage.of(job.jobId(), result);
        } catch (RuntimeException e) {
            log.error("作业 {} 执行失败", job.jobId(), e);
            reply = ErrorMessage.of(job.jobId(), e);
        }
        synchronized (jobLock) {
            current = null;
        }
        send(reply);
    }

    private void send(IpcMessage message) {
        sendFrame(FrameKind.CONTROL, codec.encode(message));
    }

    private void sendFrame(FrameKind kind, byte[] payload) {
        try {
            writer.write(kind, payload);
        } catch (IOException e) {
            if (outputBroken.compareAndSet(false, true)) {
                log.error("无法向父进程写出帧，后续输出将被丢弃", e);
            }
        }
    }

    @Override
    public void close() {
        synchronized (jobLock) {
            if (current != null) {
                current.token().cancel();
            }
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler.shutdownNow();
        runtime.close();
    }
}
