/**
 * ActiveJob.java
 *
 * 已派发到工作进程、尚未结束的作业。
 * 结果、取消宽限计时器和看门狗都可能尝试结束它，settled 标志保证只有第一个生效。
 */
package club.ppmc.kernel.pool;

import club.ppmc.kernel.model.ExecutionResult;
import club.ppmc.kernel.model.JobOptions;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

final class ActiveJob {

    private final String jobId;
    private final WorkerHandle worker;
    private final JobOptions options;
    private final CompletableFuture<ExecutionResult> future = new CompletableFuture<>();
    private final AtomicLong outputBytes = new AtomicLong();
    private final AtomicBoolean settled = new AtomicBoolean();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    private volatile ScheduledFuture<?> cancelTimer;
    private volatile ScheduledFuture<?> watchdog;

    ActiveJob(String jobId, WorkerHandle worker, JobOptions options) {
        this.jobId = jobId;
        this.worker = worker;
        this.options = options;
    }

    String jobId() {
        return jobId;
    }

    WorkerHandle worker() {
        return worker;
    }

    JobOptions options() {
        return options;
    }

    CompletableFuture<ExecutionResult> future() {
        return future;
    }

    long addOutputBytes(long bytes) {
        return outputBytes.addAndGet(bytes);
    }

    boolean isSettled() {
        return settled.get();
    }

    /** 抢占结束权，只有第一次调用返回 true。 */
    boolean claim() {
        return settled.compareAndSet(false, true);
    }

    /** 只有第一次取消请求返回 true。 */
    boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    void setCancelTimer(ScheduledFuture<?> timer) {
        this.cancelTimer = timer;
        if (settled.get()) {
            timer.cancel(false);
        }
    }

    void setWatchdog(ScheduledFuture<?> timer) {
        this.watchdog = timer;
        if (settled.get()) {
            timer.cancel(false);
        }
    }

    void cancelTimers() {
        ScheduledFuture<?> timer = cancelTimer;
        if (timer != null) {
            timer.cancel(false);
        }
        timer = watchdog;
        if (timer != null) {
            timer.cancel(false);
        }
    }
}
