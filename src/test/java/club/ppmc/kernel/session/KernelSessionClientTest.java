/**
 * KernelSessionClientTest.java
 *
 * 会话客户端：作业ID、输出转换、独占进程上的状态延续与取消。
 */
package club.ppmc.kernel.session;

import club.ppmc.kernel.model.CellRef;
import club.ppmc.kernel.model.DisplayDataOutput;
import club.ppmc.kernel.model.ExecuteCellRequest;
import club.ppmc.kernel.model.ExecutionResult;
import club.ppmc.kernel.model.ExecutionStatus;
import club.ppmc.kernel.model.InvokeHandlerRequest;
import club.ppmc.kernel.model.NotebookOutput;
import club.ppmc.kernel.model.StreamOutput;
import club.ppmc.kernel.pool.FakeWorkerLauncher;
import club.ppmc.kernel.pool.WorkerPool;
import club.ppmc.kernel.pool.WorkerPoolOptions;
import club.ppmc.kernel.protocol.IpcMessage;
import club.ppmc.kernel.protocol.RunCellMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class KernelSessionClientTest {

    @TempDir
    Path workspace;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FakeWorkerLauncher launcher = new FakeWorkerLauncher();
    private WorkerPool pool;
    private KernelSessionClient client;
    private final List<NotebookOutput> outputs = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        pool = new WorkerPool(WorkerPoolOptions.builder()
                .size(1)
                .cancelGraceMs(300)
                .workspaceRoot(workspace)
                .build(), launcher);
        client = new KernelSessionClient("s1", pool, objectMapper);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private static ExecuteCellRequest cell(String cellId, String code) {
        return new ExecuteCellRequest("nb", CellRef.javascript(cellId), code, null, null, null);
    }

    private ExecutionResult execute(String cellId, String code) throws Exception {
        return client.execute(cell(cellId, code), outputs::add).get(5, TimeUnit.SECONDS);
    }

    private List<String> runCellJobIds() {
        List<String> ids = new ArrayList<>();
        for (IpcMessage message : launcher.last().received()) {
            if (message instanceof RunCellMessage run) {
                ids.add(run.jobId());
            }
        }
        return ids;
    }

    @Test
    void streamsStdoutAsStreamOutputs() throws Exception {
        ExecutionResult result = execute("c1", "print:hi");

        assertEquals(ExecutionStatus.OK, result.status());
        assertEquals(List.of(StreamOutput.stdout("hi\n")), outputs);
    }

    @Test
    void jobIdsCarrySessionCellAndIncreasingTimestamp() throws Exception {
        execute("c1", "print:a");
        execute("c1", "print:b");

        List<String> ids = runCellJobIds();
        assertEquals(2, ids.size());
        assertTrue(ids.get(0).startsWith("s1:c1:"));
        long first = Long.parseLong(ids.get(0).substring("s1:c1:".length()));
        long second = Long.parseLong(ids.get(1).substring("s1:c1:".length()));
        assertTrue(second > first);
    }

    @Test
    void runsEveryCellOnTheSameDedicatedWorker() throws Exception {
        execute("c1", "set:answer=42");
        execute("c2", "get:answer");

        assertEquals(List.of(StreamOutput.stdout("42")), outputs);
        assertEquals(1, pool.stats().reserved());
        assertEquals(2, launcher.launchCount());
    }

    @Test
    void forwardsOnlyNotebookDisplayTypes() throws Exception {
        execute("c1", "display");

        assertEquals(1, outputs.size());
        DisplayDataOutput display = assertInstanceOf(DisplayDataOutput.class, outputs.get(0));
        assertEquals("display_data", display.type());
        assertEquals("shown", display.data().get("text/plain"));
        assertEquals("d1", display.metadata().get("display_id"));
    }

    @Test
    void cancelWithoutACurrentJobDoesNothing() throws Exception {
        client.cancel();

        assertNull(client.getCurrentJobId());
        assertEquals(ExecutionStatus.OK, execute("c1", "print:x").status());
    }

    @Test
    void cancelStopsTheCurrentJob() throws Exception {
        CompletableFuture<ExecutionResult> running = client.execute(cell("c1", "hang-cooperative"), outputs::add);
        long deadline = System.currentTimeMillis() + 5_000;
        while (pool.stats().active() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertNotNull(client.getCurrentJobId());

        client.cancel();

        assertEquals(ExecutionStatus.ABORTED, running.get(5, TimeUnit.SECONDS).status());
        assertNull(client.getCurrentJobId());
    }

    @Test
    void invokesInteractionHandlers() throws Exception {
        var request = new InvokeHandlerRequest("nb", "onClick", "click", null, "button-1", "c1", null, null, null);

        ExecutionResult result = client.invokeInteraction(request, outputs::add).get(5, TimeUnit.SECONDS);

        assertEquals(ExecutionStatus.OK, result.status());
        assertEquals(List.of(StreamOutput.stdout("handled:onClick:click")), outputs);
    }

    @Test
    void releaseDropsTheSessionState() throws Exception {
        execute("c1", "set:x=1");

        client.release();
        execute("c2", "get:x");

        assertEquals(List.of(StreamOutput.stdout("undefined")), outputs);
        assertEquals(3, launcher.launchCount());
    }

    @Test
    void reportsResetsWithTheSessionId() throws Exception {
        List<String> resets = Collections.synchronizedList(new ArrayList<>());
        client.setResetListener(resets::add);
        execute("c1", "print:first");

        client.execute(cell("c2", "crash"), outputs::add).handle((r, e) -> null).get(5, TimeUnit.SECONDS);

        long deadline = System.currentTimeMillis() + 5_000;
        while (resets.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(List.of("s1"), resets);
    }

    @Test
    void convertsDisplayPayloads() throws Exception {
        var executeResult = objectMapper.readTree(
                "{\"type\":\"execute_result\",\"data\":{\"text/plain\":\"2\",\"application/json\":2}}");
        var unknown = objectMapper.readTree("{\"type\":\"widget\",\"data\":{}}");

        DisplayDataOutput converted = client.toDisplayOutput(executeResult);

        assertEquals("execute_result", converted.type());
        assertEquals(2, converted.data().get("application/json"));
        assertTrue(converted.metadata().isEmpty());
        assertNull(client.toDisplayOutput(unknown));
    }
}
