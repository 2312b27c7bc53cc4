/**
 * InProcessWorkerLauncher.java
 *
 * 在当前 JVM 的线程里运行真实的 WorkerServer，通过内存管道与工作池通信。
 * 协议、GraalJS 运行时与工作池的组合因此可以不启动子进程而端到端地测试。
 */
package club.ppmc.kernel.pool;

import club.ppmc.kernel.protocol.IpcCodec;
import club.ppmc.kernel.worker.RuntimeOptions;
import club.ppmc.kernel.worker.WorkerServer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

class InProcessWorkerLauncher implements WorkerLauncher {

    private final AtomicInteger launches = new AtomicInteger();

    @Override
    public WorkerProcess launch(int workerId, WorkerPoolOptions options) {
        launches.incrementAndGet();
        return new InProcessWorker(workerId, options);
    }

    int launchCount() {
        return launches.get();
    }

    static final class InProcessWorker implements WorkerProcess {

        private final BytePipe stdin = new BytePipe();
        private final BytePipe stdout = new BytePipe();
        private final BytePipe stderr = new BytePipe();
        private final CompletableFuture<Integer> exit = new CompletableFuture<>();
        private final WorkerServer server;
        private final int workerId;

        InProcessWorker(int workerId, WorkerPoolOptions options) {
            this.workerId = workerId;
            Path workspace = options.getWorkspaceRoot().resolve("worker-" + workerId);
            var runtimeOptions = new RuntimeOptions(workspace, options.getBatchMs(), "npm", options.getPerJobTimeoutMs());
            this.server = new WorkerServer(
                    stdin.in(), stdout.out(), runtimeOptions, (int) options.getMaxOutputBytes(), new IpcCodec());
            var thread = new Thread(this::serve, "in-process-worker-" + workerId);
            thread.setDaemon(true);
            thread.start();
        }

        private void serve() {
            int code = 0;
            try {
                server.serve();
            } catch (IOException e) {
                code = 1;
            }
            terminate(code);
        }

        private void terminate(int code) {
            if (!exit.complete(code)) {
                return;
            }
            // close() 会等待执行线程，放到单独的线程上
            var closer = new Thread(() -> {
                server.close();
                stdout.close();
                stderr.close();
            }, "in-process-worker-" + workerId + "-close");
            closer.setDaemon(true);
            closer.start();
        }

        @Override
        public long pid() {
            return 20_000L + workerId;
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
            return !exit.isDone();
        }

        @Override
        public void kill() {
            stdin.close();
            terminate(137);
        }
    }
}
