/**
 * EventLoop.java
 *
 * 工作进程里的计时器队列，为用户代码提供 setTimeout / setInterval。
 * 所有回调都在执行线程上运行（GraalJS 上下文不允许多线程访问），
 * 执行线程在两次回调之间阻塞于 CancellationToken，取消或超时会立即唤醒它。
 */
package club.ppmc.kernel.worker;

import java.util.HashMap;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.function.BooleanSupplier;
import org.graalvm.polyglot.Value;

final class EventLoop {

    /** 浏览器与 Node 对 setInterval 的最小间隔。 */
    private static final long MIN_INTERVAL_MS = 1;

    private static final class Timer implements Comparable<Timer> {
        final int id;
        final Value callback;
        final long intervalMs;
        final boolean repeat;
        final long sequence;
        long dueAt;

        Timer(int id, Value callback, long intervalMs, boolean repeat, long sequence, long dueAt) {
            this.id = id;
            this.callback = callback;
            this.intervalMs = intervalMs;
            this.repeat = repeat;
            this.sequence = sequence;
            this.dueAt = dueAt;
        }

        @Override
        public int compareTo(Timer other) {
            int byTime = Long.compare(dueAt, other.dueAt);
            return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
        }
    }

    private final PriorityQueue<Timer> queue = new PriorityQueue<>();
    private final Map<Integer, Timer> timers = new HashMap<>();
    private int nextId;
    private long nextSequence;

    int schedule(Value callback, long delayMs, boolean repeat) {
        long delay = Math.max(repeat ? MIN_INTERVAL_MS : 0, delayMs);
        var timer = new Timer(++nextId, callback, delay, repeat, nextSequence++, System.currentTimeMillis() + delay);
        timers.put(timer.id, timer);
        queue.add(timer);
        return timer.id;
    }

    void clear(int id) {
        Timer timer = timers.remove(id);
        if (timer != null) {
            queue.remove(timer);
        }
    }

    boolean hasPending() {
        return !queue.isEmpty();
    }

    int pendingCount() {
        return queue.size();
    }

    /** 丢弃所有计时器，作业结束时调用。 */
    void clearAll() {
        queue.clear();
        timers.clear();
    }

    /**
     * 依次运行到期的计时器，直到条件满足或没有计时器为止。
     *
     * @param deadlineMillis 作业的截止时间（epoch 毫秒）。
     * @return 条件是否已满足。
     * @throws JobStoppedException 作业被取消或超过截止时间。
     */
    boolean runUntil(BooleanSupplier done, long deadlineMillis, CancellationToken token) {
        while (!done.getAsBoolean()) {
            if (!runNext(deadlineMillis, token)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 运行全部计时器，包括回调中新注册的计时器。
     */
    void drain(long deadlineMillis, CancellationToken token) {
        while (runNext(deadlineMillis, token)) {
            // 继续直到队列为空
        }
    }

    private boolean runNext(long deadlineMillis, CancellationToken token) {
        Timer next = queue.peek();
        if (next == null) {
            return false;
        }
        while (true) {
            checkStopped(token);
            long now = System.currentTimeMillis();
            if (next.dueAt <= now) {
                break;
            }
            if (now >= deadlineMillis) {
                token.timeout();
                throw new JobStoppedException();
            }
            try {
                token.await(Math.min(next.dueAt, deadlineMillis) - now);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new JobStoppedException();
            }
        }
        queue.poll();
        if (next.repeat) {
            next.dueAt = System.currentTimeMillis() + next.intervalMs;
            queue.add(next);
        } else {
            timers.remove(next.id);
        }
        next.callback.executeVoid();
        checkStopped(token);
        return true;
    }

    private static void checkStopped(CancellationToken token) {
        if (token.isStopped()) {
            throw new JobStoppedException();
        }
    }
}
