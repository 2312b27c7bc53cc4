/**
 * WorkerPool.java
 *
 * 工作池是内核的编排中心：维护固定数量的共享工作进程，按 FIFO 顺序把作业派发给空闲进程，
 * 并负责取消、超时看门狗、输出上限和崩溃恢复。会话需要保持状态时，可以通过 reserve()
 * 获得一个不占用共享槽位的独占工作进程。
 *
 * <p>线程模型：每个工作进程有一个读取线程，按输出顺序回调作业的 onStdout/onStderr/onDisplay，
 * 结果也在同一线程上完成，所以结果永远排在该作业的所有输出之后。计时器在单线程调度器上运行。
 * 槽位与等待队列由 lock 保护，活跃作业表是并发 Map，每个作业只会被结束一次。
 */
package club.ppmc.kernel.pool;

import club.ppmc.kernel.exception.KernelJobException;
import club.ppmc.kernel.exception.KernelJobException.Reason;
import club.ppmc.kernel.exception.WorkerSpawnException;
import club.ppmc.kernel.model.ExecutionResult;
import club.ppmc.kernel.model.JobKind;
import club.ppmc.kernel.model.JobOptions;
import club.ppmc.kernel.model.PoolStats;
import club.ppmc.kernel.model.WorkerSnapshot;
import club.ppmc.kernel.protocol.AckMessage;
import club.ppmc.kernel.protocol.CancelMessage;
import club.ppmc.kernel.protocol.ErrorMessage;
import club.ppmc.kernel.protocol.Frame;
import club.ppmc.kernel.protocol.FrameKind;
import club.ppmc.kernel.protocol.FrameProtocolException;
import club.ppmc.kernel.protocol.InvokeHandlerMessage;
import club.ppmc.kernel.protocol.IpcCodec;
import club.ppmc.kernel.protocol.IpcLimits;
import club.ppmc.kernel.protocol.IpcMessage;
import club.ppmc.kernel.protocol.ResultMessage;
import club.ppmc.kernel.protocol.RunCellMessage;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class WorkerPool implements AutoCloseable {

    /** 启动后这么短时间内就退出的空闲进程不会立即重建，避免启动失败时无限重启。 */
    private static final long MIN_UPTIME_FOR_EAGER_RESPAWN_MS = 1_000;

    private final WorkerPoolOptions options;
    private final WorkerLauncher launcher;
    private final IpcCodec codec;
    private final ScheduledExecutorService timers;

    private final Object lock = new Object();
    private final List<WorkerHandle> slots = new ArrayList<>();
    private final Deque<CompletableFuture<WorkerHandle>> waiters = new ArrayDeque<>();
    private final Set<ReservedWorker> reservations = ConcurrentHashMap.newKeySet();
    private final Map<String, ActiveJob> active = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<WorkerHandle>> queued = new ConcurrentHashMap<>();
    private final AtomicInteger nextWorkerId = new AtomicInteger();

    private volatile long perJobTimeoutMs;
    private boolean closed;

    public WorkerPool(WorkerPoolOptions options, WorkerLauncher launcher) {
        this(options, launcher, new IpcCodec());
    }

    public WorkerPool(WorkerPoolOptions options, WorkerLauncher launcher, IpcCodec codec) {
        this.options = options;
        this.launcher = launcher;
        this.codec = codec;
        this.perJobTimeoutMs = options.getPerJobTimeoutMs();
        this.timers = Executors.newSingleThreadScheduledExecutor(task -> {
            var thread = new Thread(task, "kernel-pool-timer");
            thread.setDaemon(true);
            return thread;
        });
        synchronized (lock) {
            for (int i = 0; i < Math.max(1, options.getSize()); i++) {
                slots.add(spawn(null));
            }
        }
        log.info("工作池已启动，共享工作进程数: {}，单作业超时: {}ms", slots.size(), perJobTimeoutMs);
    }

    /**
     * 提交一个作业。没有空闲工作进程时按提交顺序排队。
     * 无论作业以何种方式结束，工作进程都会在返回的 Future 完成之前被归还。
     *
     * @return 以执行结果完成；编排器层面的失败以 KernelJobException 拒绝。
     */
    public CompletableFuture<ExecutionResult> run(String jobId, JobOptions job) {
        CompletableFuture<ExecutionResult> invalid = validate(jobId, job);
        if (invalid != null) {
            return invalid;
        }
        CompletableFuture<WorkerHandle> waiter = new CompletableFuture<>();
        if (queued.putIfAbsent(jobId, waiter) != null) {
            return CompletableFuture.failedFuture(new IllegalStateException("重复的作业ID: " + jobId));
        }
        acquire(waiter);
        return waiter.whenComplete((worker, error) -> queued.remove(jobId, waiter))
                .thenCompose(worker -> dispatch(worker, jobId, job).whenComplete((result, error) -> release(worker)));
    }

    /**
     * 请求取消作业：先向工作进程发送 Cancel，宽限期内没有结果则强制终止该进程。
     * 仍在排队的作业直接以 CANCELLED 拒绝；未知的作业ID被忽略。
     */
    public void cancel(String jobId) {
        ActiveJob job = active.get(jobId);
        if (job == null) {
            CompletableFuture<WorkerHandle> waiter = queued.remove(jobId);
            if (waiter != null && waiter.completeExceptionally(KernelJobException.cancelled(jobId))) {
                log.info("已取消排队中的作业 {}", jobId);
            }
            return;
        }
        if (!job.requestCancel()) {
            return;
        }
        log.info("正在取消作业 {}（worker-{}）", jobId, job.worker().id());
        try {
            job.worker().send(codec.encode(new CancelMessage(jobId)));
        } catch (IOException e) {
            log.debug("向 worker-{} 发送取消消息失败: {}", job.worker().id(), e.getMessage());
        }
        job.setCancelTimer(timers.schedule(
                () -> settleExceptionally(job, KernelJobException.cancelled(jobId), true),
                options.getCancelGraceMs(),
                TimeUnit.MILLISECONDS));
    }

    /**
     * 分配一个会话独占的工作进程，它不占用共享槽位。
     */
    public ReservedWorker reserve() {
        synchronized (lock) {
            if (closed) {
                throw new KernelJobException(Reason.POOL_CLOSED, null, "Worker pool is closed");
            }
        }
        var reservation = new ReservedWorker(this);
        reservations.add(reservation);
        return reservation;
    }

    /** 修改之后提交的作业的默认超时；非正数被忽略。 */
    public void setPerJobTimeoutMs(long timeoutMs) {
        if (timeoutMs <= 0) {
            return;
        }
        this.perJobTimeoutMs = Math.min(timeoutMs, IpcLimits.MAX_TIMEOUT_MS);
        log.info("单作业超时已更新为 {}ms", this.perJobTimeoutMs);
    }

    public long getPerJobTimeoutMs() {
        return perJobTimeoutMs;
    }

    public WorkerPoolOptions getOptions() {
        return options;
    }

    public PoolStats stats() {
        synchronized (lock) {
            int idle = 0;
            int busy = 0;
            int crashed = 0;
            for (WorkerHandle worker : slots) {
                if (worker.isCrashed()) {
                    crashed++;
                } else if (worker.isBusy()) {
                    busy++;
                } else {
                    idle++;
                }
            }
            return new PoolStats(slots.size(), idle, busy, crashed, reservations.size(), active.size(), waiters.size());
        }
    }

    public List<WorkerSnapshot> workers() {
        var snapshots = new ArrayList<WorkerSnapshot>();
        synchronized (lock) {
            slots.forEach(worker -> snapshots.add(worker.snapshot()));
        }
        reservations.forEach(reservation -> reservation.snapshot().ifPresent(snapshots::add));
        return snapshots;
    }

    /**
     * 关闭工作池：拒绝所有排队与执行中的作业，并终止全部工作进程。
     */
    @Override
    public void close() {
        List<CompletableFuture<WorkerHandle>> pending;
        List<WorkerHandle> workers;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            pending = new ArrayList<>(waiters);
            waiters.clear();
            workers = new ArrayList<>(slots);
        }
        log.info("正在关闭工作池...");
        pending.forEach(waiter ->
                waiter.completeExceptionally(new KernelJobException(Reason.POOL_CLOSED, null, "Worker pool is closed")));
        for (ActiveJob job : List.copyOf(active.values())) {
            settleExceptionally(job, new KernelJobException(Reason.POOL_CLOSED, job.jobId(), "Worker pool is closed"), false);
        }
        for (ReservedWorker reservation : List.copyOf(reservations)) {
            reservation.release();
        }
        workers.forEach(WorkerHandle::kill);
        timers.shutdownNow();
    }

    boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    // --- 槽位管理 ---

    private void acquire(CompletableFuture<WorkerHandle> waiter) {
        WorkerHandle granted = null;
        RuntimeException failure = null;
        synchronized (lock) {
            if (closed) {
                failure = new KernelJobException(Reason.POOL_CLOSED, null, "Worker pool is closed");
            } else {
                boolean anyAlive = false;
                for (int i = 0; i < slots.size() && granted == null; i++) {
                    WorkerHandle worker = slots.get(i);
                    if (worker.isCrashed() && !worker.isBusy()) {
                        try {
                            worker = replaceSlot(worker);
                        } catch (WorkerSpawnException e) {
                            failure = e;
                            continue;
                        }
                    }
                    if (!worker.isCrashed()) {
                        anyAlive = true;
                        if (!worker.isBusy()) {
                            worker.setBusy(true);
                            granted = worker;
                        }
                    }
                }
                if (granted == null && (anyAlive || failure == null)) {
                    failure = null;
                    waiters.addLast(waiter);
                }
            }
        }
        if (granted != null) {
            if (!waiter.complete(granted)) {
                release(granted);
            }
        } else if (failure != null) {
            waiter.completeExceptionally(failure);
        }
    }

    private void release(WorkerHandle worker) {
        WorkerHandle granted = null;
        CompletableFuture<WorkerHandle> next = null;
        synchronized (lock) {
            worker.setBusy(false);
            if (closed || !slots.contains(worker)) {
                return;
            }
            WorkerHandle usable = worker;
            if (worker.isCrashed()) {
                try {
                    usable = replaceSlot(worker);
                } catch (WorkerSpawnException e) {
                    log.error("替换崩溃的 worker-{} 失败", worker.id(), e);
                    return;
                }
            }
            while (!waiters.isEmpty()) {
                CompletableFuture<WorkerHandle> candidate = waiters.pollFirst();
                if (!candidate.isDone()) {
                    usable.setBusy(true);
                    granted = usable;
                    next = candidate;
                    break;
                }
            }
        }
        if (next != null && !next.complete(granted)) {
            release(granted);
        }
    }

    /** 调用方必须持有 lock。 */
    private WorkerHandle replaceSlot(WorkerHandle dead) {
        int index = slots.indexOf(dead);
        WorkerHandle fresh = spawn(null);
        slots.set(index, fresh);
        log.info("worker-{} 已被 worker-{} 替换", dead.id(), fresh.id());
        return fresh;
    }

    WorkerHandle spawn(ReservedWorker reservation) {
        int id = nextWorkerId.incrementAndGet();
        WorkerProcess process = launcher.launch(id, options);
        var worker = new WorkerHandle(id, process, reservation, this);
        worker.start((int) Math.min(Integer.MAX_VALUE, options.getMaxOutputBytes()));
        return worker;
    }

    /** 以 CANCELLED 结束工作进程上的作业（如果有）并终止该进程。 */
    void cancelAndKill(WorkerHandle worker) {
        ActiveJob job = worker.currentJob();
        if (job != null) {
            settleExceptionally(job, KernelJobException.cancelled(job.jobId()), true);
        } else {
            worker.kill();
        }
    }

    void forgetReservation(ReservedWorker reservation) {
        reservations.remove(reservation);
    }

    // --- 作业派发 ---

    private CompletableFuture<ExecutionResult> validate(String jobId, JobOptions job) {
        if (jobId == null || jobId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("作业ID不能为空"));
        }
        if (job.getKind() == JobKind.EXECUTE && (job.getCell() == null || job.getCode() == null)) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("执行作业必须包含单元格和代码"));
        }
        if (job.getKind() == JobKind.INVOKE_HANDLER && (job.getHandlerId() == null || job.getEvent() == null)) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("处理函数调用必须包含 handlerId 和 event"));
        }
        Long timeoutMs = job.getTimeoutMs();
        if (timeoutMs != null && (timeoutMs <= 0 || timeoutMs > IpcLimits.MAX_TIMEOUT_MS)) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("超时必须在 1 到 " + IpcLimits.MAX_TIMEOUT_MS + " 毫秒之间"));
        }
        if (active.containsKey(jobId)) {
            return CompletableFuture.failedFuture(new IllegalStateException("重复的作业ID: " + jobId));
        }
        return null;
    }

    /**
     * 把作业发给指定的工作进程。返回的 Future 只会由结果、取消、看门狗、输出上限或进程退出之一完成。
     */
    CompletableFuture<ExecutionResult> dispatch(WorkerHandle worker, String jobId, JobOptions job) {
        long timeoutMs = job.getTimeoutMs() != null ? job.getTimeoutMs() : perJobTimeoutMs;
        var activeJob = new ActiveJob(jobId, worker, job);
        if (active.putIfAbsent(jobId, activeJob) != null) {
            return CompletableFuture.failedFuture(new IllegalStateException("重复的作业ID: " + jobId));
        }
        worker.attach(activeJob);
        if (worker.isCrashed()) {
            settleExceptionally(activeJob, crashed(jobId, worker, null), false);
            return activeJob.future();
        }
        activeJob.setWatchdog(timers.schedule(
                () -> settleExceptionally(
                        activeJob,
                        new KernelJobException(Reason.TIMEOUT, jobId, "Execution exceeded " + timeoutMs + "ms"),
                        true),
                timeoutMs + options.getWatchdogSlackMs(),
                TimeUnit.MILLISECONDS));
        try {
            worker.send(codec.encode(toMessage(jobId, job, timeoutMs)));
            log.debug("作业 {} 已派发到 worker-{}", jobId, worker.id());
        } catch (IOException e) {
            settleExceptionally(activeJob, crashed(jobId, worker, e), true);
        }
        return activeJob.future();
    }

    private static IpcMessage toMessage(String jobId, JobOptions job, long timeoutMs) {
        String notebookId = job.getNotebookId() != null ? job.getNotebookId() : "default";
        if (job.getKind() == JobKind.INVOKE_HANDLER) {
            return new InvokeHandlerMessage(
                    jobId,
                    job.getHandlerId(),
                    notebookId,
                    job.getEnv(),
                    job.getEvent(),
                    job.getPayload(),
                    job.getComponentId(),
                    job.getCellId(),
                    timeoutMs,
                    job.getGlobals());
        }
        return new RunCellMessage(
                jobId, job.getCell(), job.getCode(), notebookId, job.getEnv(), timeoutMs, job.getGlobals());
    }

    // --- 来自工作进程读取线程的事件 ---

    void onFrame(WorkerHandle worker, Frame frame) {
        ActiveJob job = worker.currentJob();
        switch (frame.kind()) {
            case STDOUT, STDERR -> {
                if (job == null || job.isSettled() || exceedsOutputLimit(worker, job, frame)) {
                    return;
                }
                Consumer<String> callback = frame.kind() == FrameKind.STDOUT
                        ? job.options().getOnStdout()
                        : job.options().getOnStderr();
                deliver(job, callback, frame.text());
            }
            case DISPLAY -> {
                if (job == null || job.isSettled() || exceedsOutputLimit(worker, job, frame)) {
                    return;
                }
                JsonNode display;
                try {
                    display = codec.objectMapper().readTree(frame.payload());
                } catch (IOException e) {
                    log.debug("丢弃无法解析的 display 帧: {}", e.getMessage());
                    return;
                }
                deliver(job, job.options().getOnDisplay(), display);
            }
            case CONTROL -> codec.decode(frame.payload()).ifPresent(message -> onControl(worker, message));
        }
    }

    /** stdout、stderr 与 display 帧共用同一个字节上限，超出时以 OUTPUT_LIMIT 结束作业并终止进程。 */
    private boolean exceedsOutputLimit(WorkerHandle worker, ActiveJob job, Frame frame) {
        if (job.addOutputBytes(frame.encodedSize()) <= options.getMaxOutputBytes()) {
            return false;
        }
        log.warn("作业 {} 的输出超过上限 {} 字节，终止 worker-{}", job.jobId(), options.getMaxOutputBytes(), worker.id());
        settleExceptionally(job, KernelJobException.outputLimit(job.jobId()), true);
        return true;
    }

    private void onControl(WorkerHandle worker, IpcMessage message) {
        ActiveJob job = active.get(message.jobId());
        if (job == null || job.worker() != worker) {
            log.debug("忽略与当前作业无关的消息 {}（jobId={}）", message.getClass().getSimpleName(), message.jobId());
            return;
        }
        if (message instanceof AckMessage) {
            log.debug("worker-{} 已开始执行作业 {}", worker.id(), job.jobId());
        } else if (message instanceof ResultMessage result) {
            settle(job, result.toResult());
        } else if (message instanceof ErrorMessage error) {
            String name = error.name() != null ? error.name() : "WorkerError";
            settleExceptionally(
                    job, new KernelJobException(Reason.WORKER_ERROR, job.jobId(), name + ": " + error.message()), false);
        } else {
            log.debug("忽略来自工作进程的 {} 消息", message.getClass().getSimpleName());
        }
    }

    void onProtocolError(WorkerHandle worker, FrameProtocolException error) {
        ActiveJob job = worker.currentJob();
        if (job != null && error.isOversized()) {
            log.warn("worker-{} 发出了超过上限的帧（{} 字节）", worker.id(), error.getDeclaredLength());
            settleExceptionally(job, KernelJobException.outputLimit(job.jobId()), true);
            return;
        }
        log.error("worker-{} 的输出流格式错误，将终止该进程: {}", worker.id(), error.getMessage());
        if (job != null) {
            settleExceptionally(
                    job, new KernelJobException(Reason.WORKER_ERROR, job.jobId(), "Malformed worker output", error), true);
        } else {
            worker.kill();
        }
    }

    void onWorkerExit(WorkerHandle worker, Integer exitCode) {
        boolean expected = worker.isCrashed();
        worker.markCrashed();
        if (expected) {
            log.debug("worker-{} 已退出，退出码: {}", worker.id(), exitCode);
        } else {
            log.warn("worker-{} 意外退出，退出码: {}", worker.id(), exitCode);
        }
        ActiveJob job = worker.currentJob();
        if (job != null) {
            settleExceptionally(job, crashed(job.jobId(), worker, exitCode), false);
        }
        if (worker.isReserved()) {
            worker.reservation().onWorkerExit(worker);
            return;
        }
        synchronized (lock) {
            if (closed || worker.isBusy() || !slots.contains(worker)) {
                return;
            }
            if (worker.uptimeMs() < MIN_UPTIME_FOR_EAGER_RESPAWN_MS) {
                log.error("worker-{} 启动后立即退出，推迟到下次分配时再重建", worker.id());
                return;
            }
        }
        // 空闲时退出的进程立即替换，等待者由 release 接手
        release(worker);
    }

    // --- 结束作业 ---

    private void settle(ActiveJob job, ExecutionResult result) {
        if (!job.claim()) {
            return;
        }
        cleanup(job);
        job.future().complete(result);
    }

    private void settleExceptionally(ActiveJob job, Throwable error, boolean killWorker) {
        if (!job.claim()) {
            return;
        }
        cleanup(job);
        if (killWorker) {
            job.worker().kill();
        }
        log.info("作业 {} 失败: {}", job.jobId(), error.getMessage());
        job.future().completeExceptionally(error);
    }

    private void cleanup(ActiveJob job) {
        job.cancelTimers();
        active.remove(job.jobId(), job);
        job.worker().detach(job);
    }

    private static KernelJobException crashed(String jobId, WorkerHandle worker, Object detail) {
        String message = "Worker exited unexpectedly";
        if (detail instanceof Integer code) {
            message += " (exit code " + code + ")";
        } else if (detail instanceof Throwable error) {
            return new KernelJobException(Reason.WORKER_CRASHED, jobId, message + ": " + error.getMessage(), error);
        }
        log.debug("worker-{} 上的作业 {} 因进程退出而失败", worker.id(), jobId);
        return new KernelJobException(Reason.WORKER_CRASHED, jobId, message);
    }

    private static <T> void deliver(ActiveJob job, Consumer<T> callback, T value) {
        try {
            callback.accept(value);
        } catch (RuntimeException e) {
            log.warn("作业 {} 的输出回调抛出异常", job.jobId(), e);
        }
    }
}
