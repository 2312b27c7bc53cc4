/**
 * FakeWorkerProcess.java
 *
 * 在线程上模拟的工作进程，脚本指令见 FakeWorkerLauncher。
 * 与真实工作进程一样：同一时间只执行一个作业，忙碌时以 WorkerBusy 错误回复，
 * 先发 Ack，输出帧全部写出之后才发 Result。
 */
package club.ppmc.kernel.pool;

import club.ppmc.kernel.model.DisplayDataOutput;
import club.ppmc.kernel.model.ErrorOutput;
import club.ppmc.kernel.model.ExecutionError;
import club.ppmc.kernel.model.ExecutionRecord;
import club.ppmc.kernel.model.ExecutionStatus;
import club.ppmc.kernel.model.NotebookOutput;
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
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

public class FakeWorkerProcess implements WorkerProcess {

    private final int workerId;
    private final BytePipe stdin = new BytePipe();
    private final BytePipe stdout = new BytePipe();
    private final BytePipe stderr = new BytePipe();
    private final FrameWriter writer = new FrameWriter(stdout.out());
    private final IpcCodec codec = new IpcCodec();
    private final CompletableFuture<Integer> exit = new CompletableFuture<>();
    private final ExecutorService executor;
    private final Map<String, String> state = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> cancellations = new ConcurrentHashMap<>();
    private final List<IpcMessage> received = new CopyOnWriteArrayList<>();
    private final AtomicReference<String> currentJob = new AtomicReference<>();
    private volatile boolean alive = true;

    FakeWorkerProcess(int workerId) {
        this.workerId = workerId;
        this.executor = Executors.newSingleThreadExecutor(task -> {
            var thread = new Thread(task, "fake-worker-" + workerId + "-exec");
            thread.setDaemon(true);
            return thread;
        });
    }

    void start() {
        var reader = new Thread(this::readControl, "fake-worker-" + workerId + "-control");
        reader.setDaemon(true);
        reader.start();
        try {
            stderr.out().write(("fake worker " + workerId + " ready\n").getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    public List<IpcMessage> received() {
        return received;
    }

    public int workerId() {
        return workerId;
    }

    /** 模拟进程退出（例如被操作系统杀死）。 */
    public void exit(int code) {
        synchronized (this) {
            if (!alive) {
                return;
            }
            alive = false;
        }
        stdout.close();
        stderr.close();
        stdin.close();
        executor.shutdownNow();
        exit.complete(code);
    }

    @Override
    public long pid() {
        return 10_000L + workerId;
    }

    @Override
    public OutputStream stdin() {
        return stdin.out();
    }

    @Override
    public InputStream stdout() {
        return stdout.in();
    }

    @Override
    public InputStream stderr() {
        return stderr.in();
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return exit;
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public void kill() {
        exit(137);
    }

    private void readControl() {
        var reader = new FrameReader(stdin.in(), 1 << 20);
        try {
            Frame frame;
            while ((frame = reader.next()) != null) {
                if (frame.kind() == FrameKind.CONTROL) {
                    codec.decode(frame.payload()).ifPresent(this::handle);
                }
            }
        } catch (IOException e) {
            // 进程已退出
        }
    }

    private void handle(IpcMessage message) {
        received.add(message);
        if (message instanceof CancelMessage cancel) {
            CountDownLatch latch = cancellations.get(cancel.jobId());
            if (latch != null) {
                latch.countDown();
            }
            return;
        }
        if (!currentJob.compareAndSet(null, message.jobId())) {
            send(new ErrorMessage(message.jobId(), "WorkerBusy", "Worker is busy with job " + currentJob.get(), null));
            return;
        }
        cancellations.put(message.jobId(), new CountDownLatch(1));
        executor.submit(() -> run(message));
    }

    private void run(IpcMessage message) {
        String jobId = message.jobId();
        send(new AckMessage(jobId));
        long started = System.currentTimeMillis();
        IpcMessage reply;
        try {
            if (message instanceof InvokeHandlerMessage invoke) {
                text(FrameKind.STDOUT, "handled:" + invoke.handlerId() + ":" + invoke.event());
                reply = ok(jobId, started, List.of());
            } else {
                reply = execute(jobId, ((RunCellMessage) message).code(), started);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reply = null;
        } finally {
            cancellations.remove(jobId);
            currentJob.compareAndSet(jobId, null);
        }
        if (reply != null) {
            send(reply);
        }
    }

    private IpcMessage execute(String jobId, String code, long started) throws InterruptedException {
        String command = code.contains(":") ? code.substring(0, code.indexOf(':')) : code;
        String argument = code.contains(":") ? code.substring(code.indexOf(':') + 1) : "";
        switch (command) {
            case "print" -> text(FrameKind.STDOUT, argument + "\n");
            case "stderr" -> text(FrameKind.STDERR, argument + "\n");
            case "hang" -> {
                new CountDownLatch(1).await();
                return null;
            }
            case "hang-cooperative" -> {
                cancellations.get(jobId).await();
                var error = ExecutionError.of("CancelledError", "Execution cancelled");
                return new ResultMessage(jobId, List.of(ErrorOutput.from(error)),
                        new ExecutionRecord(started, System.currentTimeMillis(), ExecutionStatus.ABORTED, error));
            }
            case "flood" -> {
                String chunk = "x".repeat(1000);
                for (int i = 0; i < Integer.parseInt(argument) && alive; i++) {
                    text(FrameKind.STDOUT, chunk);
                }
            }
            case "display-flood" -> {
                String frame = "{\"type\":\"display_data\",\"data\":{\"text/plain\":\"" + "z".repeat(1000) + "\"}}";
                for (int i = 0; i < Integer.parseInt(argument) && alive; i++) {
                    text(FrameKind.DISPLAY, frame);
                }
            }
            case "crash" -> {
                text(FrameKind.STDOUT, "about to crash\n");
                exit(1);
                return null;
            }
            case "set" -> {
                String[] pair = argument.split("=", 2);
                state.put(pair[0], pair[1]);
            }
            case "get" -> text(FrameKind.STDOUT, state.getOrDefault(argument, "undefined"));
            case "error" -> {
                return new ErrorMessage(jobId, "InternalError", argument, null);
            }
            case "sleep" -> Thread.sleep(Long.parseLong(argument));
            case "big-result" -> {
                var display = new DisplayDataOutput(
                        "execute_result", Map.of("text/plain", "y".repeat(Integer.parseInt(argument))), Map.of());
                return ok(jobId, started, List.of(display));
            }
            case "display" -> {
                text(FrameKind.DISPLAY, "{\"type\":\"display_data\",\"data\":{\"text/plain\":\"shown\"},"
                        + "\"metadata\":{\"display_id\":\"d1\"}}");
                text(FrameKind.DISPLAY, "{\"type\":\"custom\",\"data\":{}}");
            }
            default -> throw new IllegalArgumentException("unknown script: " + code);
        }
        return ok(jobId, started, List.of());
    }

    private static ResultMessage ok(String jobId, long started, List<NotebookOutput> outputs) {
        return new ResultMessage(jobId, outputs, ExecutionRecord.ok(started, System.currentTimeMillis()));
    }

    private void text(FrameKind kind, String text) {
        try {
            writer.writeText(kind, text);
        } catch (IOException e) {
            // 进程已退出，丢弃
        }
    }

    private void send(IpcMessage message) {
        try {
            writer.write(FrameKind.CONTROL, codec.encode(message));
        } catch (IOException e) {
            // 进程已退出，丢弃
        }
    }
}
