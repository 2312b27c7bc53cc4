/**
 * FakeWorkerLauncher.java
 *
 * 测试用的工作进程启动器。它启动的 FakeWorkerProcess 运行在当前 JVM 的线程上，
 * 但与工作池之间说的是真实的帧协议，执行的"代码"是一小段脚本指令：
 *
 * <ul>
 *   <li>{@code print:text} 输出一行 stdout；{@code stderr:text} 输出到 stderr</li>
 *   <li>{@code hang} 永不返回，也不理会取消；{@code hang-cooperative} 收到取消后返回 aborted</li>
 *   <li>{@code flood:n} 输出 n 个 1000 字节的 stdout 帧</li>
 *   <li>{@code crash} 输出一点内容后进程退出</li>
 *   <li>{@code set:k=v} / {@code get:k} 在进程内保存和读取状态</li>
 *   <li>{@code error:msg} 回复 Error 消息；{@code sleep:ms} 等待后返回</li>
 *   <li>{@code big-result:n} 返回一个 n 字符的 execute_result；{@code display} 发出两个 DISPLAY 帧</li>
 * </ul>
 */
package club.ppmc.kernel.pool;

import club.ppmc.kernel.exception.WorkerSpawnException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class FakeWorkerLauncher implements WorkerLauncher {

    private final List<FakeWorkerProcess> launched = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public WorkerProcess launch(int workerId, WorkerPoolOptions options) {
        if (failing) {
            throw new WorkerSpawnException("spawning disabled in test", null);
        }
        var process = new FakeWorkerProcess(workerId);
        process.start();
        launched.add(process);
        return process;
    }

    public int launchCount() {
        return launched.size();
    }

    public List<FakeWorkerProcess> launched() {
        return launched;
    }

    public FakeWorkerProcess last() {
        return launched.get(launched.size() - 1);
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }
}
