/**
 * InProcessWorkerIntegrationTest.java
 *
 * 工作池 + 帧协议 + WorkerServer + GraalJS 运行时的端到端测试，工作进程运行在测试 JVM 的线程中。
 */
package club.ppmc.kernel.pool;

import club.ppmc.kernel.model.CellRef;
import club.ppmc.kernel.model.DisplayDataOutput;
import club.ppmc.kernel.model.ExecuteCellRequest;
import club.ppmc.kernel.model.ExecutionResult;
import club.ppmc.kernel.model.ExecutionStatus;
import club.ppmc.kernel.model.JobOptions;
import club.ppmc.kernel.model.NotebookOutput;
import club.ppmc.kernel.model.StreamOutput;
import club.ppmc.kernel.session.KernelSessionClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static club.ppmc.kernel.pool.WorkerPoolTest.await;
import static club.ppmc.kernel.pool.WorkerPoolTest.waitUntil;
import static org.junit.jupiter.api.Assertions.*;

class InProcessWorkerIntegrationTest {

    @TempDir
    Path workspace;

    private final InProcessWorkerLauncher launcher = new InProcessWorkerLauncher();
    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        pool = new WorkerPool(WorkerPoolOptions.builder()
                .size(1)
                .perJobTimeoutMs(5_000)
                .cancelGraceMs(3_000)
                .watchdogSlackMs(3_000)
                .batchMs(10)
                .workspaceRoot(workspace)
                .build(), launcher);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private static JobOptions job(String code) {
        return JobOptions.builder().cell(CellRef.javascript("c1")).code(code).notebookId("nb").build();
    }

    private static String plainText(ExecutionResult result) {
        var display = assertInstanceOf(DisplayDataOutput.class, result.outputs().get(0));
        return (String) display.data().get("text/plain");
    }

    @Test
    void executesJavaScriptAndStreamsConsole() throws Exception {
        List<String> stdout = Collections.synchronizedList(new ArrayList<>());
        JobOptions options = job("console.log('hi')\n6 * 7").toBuilder().onStdout(stdout::add).build();

        ExecutionResult result = await(pool.run("j1", options));

        assertEquals(ExecutionStatus.OK, result.status());
        assertEquals("42", plainText(result));
        assertEquals("hi\n", String.join("", stdout));
    }

    @Test
    void workerTimeoutAbortsJobAndKeepsWorker() throws Exception {
        JobOptions options = job("while (true) {}").toBuilder().timeoutMs(300L).build();

        ExecutionResult result = await(pool.run("j1", options));

        assertEquals(ExecutionStatus.ABORTED, result.status());
        assertEquals("TimeoutError", result.execution().error().name());
        assertEquals(ExecutionStatus.OK, await(pool.run("j2", job("1 + 1"))).status());
        assertEquals(1, launcher.launchCount());
    }

    @Test
    void pendingTimerTimesOutPromptlyAndNextJobRunsOnSameWorker() throws Exception {
        assertEquals("1", plainText(await(pool.run("warmup", job("1")))));
        JobOptions sleeper =
                job("await new Promise(r => setTimeout(r, 5000))").toBuilder().timeoutMs(100L).build();

        long started = System.currentTimeMillis();
        ExecutionResult result = await(pool.run("a", sleeper));
        long elapsed = System.currentTimeMillis() - started;

        assertEquals(ExecutionStatus.ABORTED, result.status());
        assertEquals("TimeoutError", result.execution().error().name());
        assertTrue(elapsed >= 100 && elapsed < 2_000, "timed out after " + elapsed + "ms");
        assertEquals("2", plainText(await(pool.run("b", job("1 + 1")))));
        assertEquals(1, launcher.launchCount());
    }

    @Test
    void streamAndDisplayOutputKeepTheirOrder() throws Exception {
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        JobOptions options = job("console.log('a')\nconsole.error('b')\ndisplay('c')\nconsole.log('d')\nundefined")
                .toBuilder()
                .onStdout(text -> events.add("out:" + text))
                .onStderr(text -> events.add("err:" + text))
                .onDisplay(display -> events.add("display:" + display.path("data").path("text/plain").asText()))
                .build();

        ExecutionResult result = await(pool.run("j1", options));

        assertEquals(ExecutionStatus.OK, result.status());
        assertEquals(List.of("out:a\n", "err:b\n", "display:'c'", "out:d\n"), mergeAdjacent(events));
    }

    /** 批量刷新可能把同一个流的文本拆成多帧，比较前合并相邻的同类事件。 */
    private static List<String> mergeAdjacent(List<String> events) {
        List<String> merged = new ArrayList<>();
        for (String event : events) {
            int last = merged.size() - 1;
            String kind = event.substring(0, event.indexOf(':') + 1);
            if (last >= 0 && !kind.equals("display:") && merged.get(last).startsWith(kind)) {
                merged.set(last, merged.get(last) + event.substring(kind.length()));
            } else {
                merged.add(event);
            }
        }
        return merged;
    }

    @Test
    void cancelInterruptsRunningLoop() throws Exception {
        var future = pool.run("j1", job("while (true) {}"));
        waitUntil(() -> pool.stats().active() == 1);

        pool.cancel("j1");
        ExecutionResult result = await(future);

        assertEquals(ExecutionStatus.ABORTED, result.status());
        assertEquals("CancelledError", result.execution().error().name());
        assertEquals(1, launcher.launchCount());
    }

    @Test
    void sessionKeepsStateOnItsReservedWorker() throws Exception {
        var client = new KernelSessionClient("s1", pool, new ObjectMapper());
        List<NotebookOutput> outputs = Collections.synchronizedList(new ArrayList<>());
        try {
            await(client.execute(new ExecuteCellRequest("nb", CellRef.javascript("c1"),
                    "const greeting = 'hello'", null, null, null), outputs::add));
            ExecutionResult result = await(client.execute(new ExecuteCellRequest("nb", CellRef.javascript("c2"),
                    "console.log(greeting)\ngreeting.length", null, null, null), outputs::add));

            assertEquals("5", plainText(result));
            assertEquals(List.of(StreamOutput.stdout("hello\n")), outputs);
        } finally {
            client.release();
        }
    }
}
