/**
 * CancellationToken.java
 *
 * 单个作业的停止信号。作业可能因取消或超时而停止，两者只有第一个生效。
 * 执行线程在等待计时器时阻塞在这里，停止时会被立即唤醒。
 */
package club.ppmc.kernel.worker;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class CancellationToken {

    public enum State {
        RUNNING,
        CANCELLED,
        TIMED_OUT
    }

    private final List<Consumer<State>> stopListeners = new ArrayList<>();
    private State state = State.RUNNING;
    private boolean finished;

    public boolean cancel() {
        return stop(State.CANCELLED);
    }

    public boolean timeout() {
        return stop(State.TIMED_OUT);
    }

    private boolean stop(State reason) {
        List<Consumer<State>> listeners;
        synchronized (this) {
            if (state != State.RUNNING || finished) {
                return false;
            }
            state = reason;
            notifyAll();
            listeners = List.copyOf(stopListeners);
        }
        for (Consumer<State> listener : listeners) {
            try {
                listener.accept(reason);
            } catch (RuntimeException e) {
                log.warn("停止回调抛出异常", e);
            }
        }
        return true;
    }

    /** 注册停止回调；已经停止时立即调用。 */
    public void onStop(Consumer<State> listener) {
        State current;
        synchronized (this) {
            if (state == State.RUNNING) {
                stopListeners.add(listener);
                return;
            }
            current = state;
        }
        listener.accept(current);
    }

    public synchronized State state() {
        return state;
    }

    public synchronized boolean isStopped() {
        return state != State.RUNNING;
    }

    /** 作业已结束，之后的停止请求无效。 */
    public synchronized void finish() {
        finished = true;
        notifyAll();
    }

    public synchronized boolean isFinished() {
        return finished;
    }

    /**
     * 最多等待给定的毫秒数，作业被停止或结束时提前返回。
     */
    public synchronized void await(long millis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + millis;
        long remaining = millis;
        while (state == State.RUNNING && !finished && remaining > 0) {
            wait(remaining);
            remaining = deadline - System.currentTimeMillis();
        }
    }

    /** 等待作业结束，用于停止后的中断循环。 */
    public synchronized void awaitFinished(long millis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + millis;
        long remaining = millis;
        while (!finished && remaining > 0) {
            wait(remaining);
            remaining = deadline - System.currentTimeMillis();
        }
    }
}
