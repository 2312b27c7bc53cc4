/**
 * ReservedWorker.java
 *
 * 会话独占的工作进程。同一会话的作业在它上面串行执行，全局变量和定义在作业之间保留。
 * 进程被强制终止或崩溃后会透明地换成新进程，并通过重置监听器告知会话状态已丢失。
 */
package club.ppmc.kernel.pool;

import club.ppmc.kernel.exception.KernelJobException;
import club.ppmc.kernel.exception.KernelJobException.Reason;
import club.ppmc.kernel.model.ExecutionResult;
import club.ppmc.kernel.model.JobOptions;
import club.ppmc.kernel.model.WorkerSnapshot;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ReservedWorker {

    private final WorkerPool pool;
    private final Set<String> pending = new HashSet<>();
    private final Set<String> cancelledBeforeStart = new HashSet<>();

    private WorkerHandle worker;
    private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);
    private boolean released;
    private int generation;
    private volatile Runnable resetListener = () -> {};

    ReservedWorker(WorkerPool pool) {
        this.pool = pool;
        this.worker = pool.spawn(this);
    }

    /** 进程被替换（会话状态丢失）时回调。 */
    public void setResetListener(Runnable resetListener) {
        this.resetListener = resetListener != null ? resetListener : () -> {};
    }

    /**
     * 在独占进程上执行作业；前一个作业结束（无论成败）之后才开始。
     */
    public synchronized CompletableFuture<ExecutionResult> run(String jobId, JobOptions job) {
        if (released) {
            return CompletableFuture.failedFuture(
                    new KernelJobException(Reason.POOL_CLOSED, jobId, "Reserved worker has been released"));
        }
        pending.add(jobId);
        CompletableFuture<ExecutionResult> result =
                tail.handle((value, error) -> null).thenCompose(ignored -> runNow(jobId, job));
        tail = result;
        return result;
    }

    private CompletableFuture<ExecutionResult> runNow(String jobId, JobOptions job) {
        synchronized (this) {
            pending.remove(jobId);
            if (cancelledBeforeStart.remove(jobId)) {
                return CompletableFuture.failedFuture(KernelJobException.cancelled(jobId));
            }
        }
        WorkerHandle current;
        try {
            current = ensureWorker();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        current.setBusy(true);
        return pool.dispatch(current, jobId, job).whenComplete((result, error) -> current.setBusy(false));
    }

    /**
     * 取消作业。作业还在排队时，轮到它时直接以 CANCELLED 结束。
     */
    public void cancel(String jobId) {
        synchronized (this) {
            if (pending.contains(jobId)) {
                cancelledBeforeStart.add(jobId);
            }
        }
        pool.cancel(jobId);
    }

    /** 已请求取消、但还没轮到执行的作业数。 */
    synchronized int cancelledBeforeStartCount() {
        return cancelledBeforeStart.size();
    }

    /**
     * 终止独占进程并归还预留。正在执行的作业以 CANCELLED 结束。
     */
    public void release() {
        WorkerHandle current;
        synchronized (this) {
            if (released) {
                return;
            }
            released = true;
            current = worker;
            worker = null;
        }
        pool.forgetReservation(this);
        if (current != null) {
            pool.cancelAndKill(current);
            log.info("独占的 worker-{} 已释放", current.id());
        }
    }

    public synchronized boolean isReleased() {
        return released;
    }

    /** 进程被替换的次数。 */
    public synchronized int getGeneration() {
        return generation;
    }

    Optional<WorkerSnapshot> snapshot() {
        WorkerHandle current;
        synchronized (this) {
            current = worker;
        }
        return Optional.ofNullable(current).map(WorkerHandle::snapshot);
    }

    private WorkerHandle ensureWorker() {
        boolean replaced = false;
        WorkerHandle current;
        synchronized (this) {
            if (released || pool.isClosed()) {
                throw new KernelJobException(Reason.POOL_CLOSED, null, "Reserved worker has been released");
            }
            if (worker == null || worker.isCrashed()) {
                worker = pool.spawn(this);
                generation++;
                replaced = true;
            }
            current = worker;
        }
        if (replaced) {
            notifyReset(current);
        }
        return current;
    }

    /** 由工作池在进程退出后调用；当前进程意外退出时立即重建。 */
    void onWorkerExit(WorkerHandle dead) {
        WorkerHandle fresh;
        synchronized (this) {
            if (released || dead != worker || pool.isClosed()) {
                return;
            }
            try {
                worker = pool.spawn(this);
            } catch (RuntimeException e) {
                log.error("重建独占工作进程失败，将在下一个作业时重试", e);
                return;
            }
            generation++;
            fresh = worker;
        }
        notifyReset(fresh);
    }

    private void notifyReset(WorkerHandle fresh) {
        log.info("独占工作进程已替换为 worker-{}，会话状态已重置", fresh.id());
        try {
            resetListener.run();
        } catch (RuntimeException e) {
            log.warn("会话重置回调抛出异常", e);
        }
    }
}
