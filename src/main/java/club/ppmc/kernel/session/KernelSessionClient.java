/**
 * KernelSessionClient.java
 *
 * 一个笔记本会话面向内核的入口。首次执行时向工作池预留一个独占进程，
 * 之后该会话的所有单元格都在同一进程中运行，使定义和变量在单元格之间延续。
 * 它负责生成作业ID，把工作池的原始回调转换为笔记本输出，并跟踪当前作业以支持取消。
 */
package club.ppmc.kernel.session;

import club.ppmc.kernel.model.DisplayDataOutput;
import club.ppmc.kernel.model.ExecuteCellRequest;
import club.ppmc.kernel.model.ExecutionResult;
import club.ppmc.kernel.model.InvokeHandlerRequest;
import club.ppmc.kernel.model.JobKind;
import club.ppmc.kernel.model.JobOptions;
import club.ppmc.kernel.model.NotebookEnv;
import club.ppmc.kernel.model.StreamOutput;
import club.ppmc.kernel.pool.ReservedWorker;
import club.ppmc.kernel.pool.WorkerPool;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class KernelSessionClient {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final String sessionId;
    private final WorkerPool pool;
    private final ObjectMapper objectMapper;
    private final AtomicLong lastTimestamp = new AtomicLong();

    private ReservedWorker reserved;
    private volatile String currentJobId;
    private volatile SessionResetListener resetListener = id -> {};

    public KernelSessionClient(String sessionId, WorkerPool pool, ObjectMapper objectMapper) {
        this.sessionId = sessionId;
        this.pool = pool;
        this.objectMapper = objectMapper;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getCurrentJobId() {
        return currentJobId;
    }

    public void setResetListener(SessionResetListener resetListener) {
        this.resetListener = resetListener != null ? resetListener : id -> {};
    }

    /**
     * 在会话的独占进程上执行一个单元格。
     *
     * @param listener 接收执行期间的 stdout/stderr 与展示输出。
     * @return 以最终结果完成；取消、超时、崩溃等以 KernelJobException 拒绝。
     */
    public CompletableFuture<ExecutionResult> execute(ExecuteCellRequest request, OutputListener listener) {
        String jobId = nextJobId(request.cell().id());
        JobOptions job = withCallbacks(JobOptions.builder(), listener)
                .kind(JobKind.EXECUTE)
                .cell(request.cell())
                .code(request.code())
                .notebookId(request.notebookId())
                .env(request.env() != null ? request.env() : NotebookEnv.empty())
                .globals(request.globals())
                .timeoutMs(request.timeoutMs())
                .build();
        return submit(jobId, job);
    }

    /**
     * 调用笔记本中注册的交互处理函数，例如响应前端组件的事件。
     */
    public CompletableFuture<ExecutionResult> invokeInteraction(InvokeHandlerRequest request, OutputListener listener) {
        String jobId = nextJobId(request.handlerId());
        JobOptions job = withCallbacks(JobOptions.builder(), listener)
                .kind(JobKind.INVOKE_HANDLER)
                .handlerId(request.handlerId())
                .event(request.event())
                .payload(request.payload())
                .componentId(request.componentId())
                .cellId(request.cellId())
                .notebookId(request.notebookId())
                .env(request.env() != null ? request.env() : NotebookEnv.empty())
                .globals(request.globals())
                .timeoutMs(request.timeoutMs())
                .build();
        return submit(jobId, job);
    }

    /**
     * 取消当前作业；没有正在执行的作业时什么也不做。
     */
    public void cancel() {
        String jobId = currentJobId;
        if (jobId == null) {
            return;
        }
        ReservedWorker worker;
        synchronized (this) {
            worker = reserved;
        }
        if (worker != null) {
            worker.cancel(jobId);
        } else {
            pool.cancel(jobId);
        }
    }

    /**
     * 终止会话的独占进程。之后再次执行会预留一个新的进程（状态从空白开始）。
     */
    public void release() {
        ReservedWorker worker;
        synchronized (this) {
            worker = reserved;
            reserved = null;
        }
        if (worker != null) {
            worker.release();
            log.info("会话 {} 已释放其独占工作进程", sessionId);
        }
    }

    private CompletableFuture<ExecutionResult> submit(String jobId, JobOptions job) {
        currentJobId = jobId;
        CompletableFuture<ExecutionResult> future;
        try {
            future = reservedWorker().run(jobId, job);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((result, error) -> {
            if (jobId.equals(currentJobId)) {
                currentJobId = null;
            }
        });
    }

    private synchronized ReservedWorker reservedWorker() {
        if (reserved == null) {
            reserved = pool.reserve();
            reserved.setResetListener(() -> resetListener.onSessionReset(sessionId));
        }
        return reserved;
    }

    private JobOptions.JobOptionsBuilder withCallbacks(JobOptions.JobOptionsBuilder builder, OutputListener listener) {
        return builder.onStdout(text -> listener.onOutput(StreamOutput.stdout(text)))
                .onStderr(text -> listener.onOutput(StreamOutput.stderr(text)))
                .onDisplay(display -> {
                    DisplayDataOutput output = toDisplayOutput(display);
                    if (output != null) {
                        listener.onOutput(output);
                    }
                });
    }

    /** 只转发 display_data / update_display_data / execute_result，其余类型丢弃。 */
    DisplayDataOutput toDisplayOutput(JsonNode display) {
        String type = display.path("type").asText("");
        if (!DisplayDataOutput.DISPLAY_TYPES.contains(type)) {
            return null;
        }
        Map<String, Object> data = objectMapper.convertValue(display.path("data"), MAP_TYPE);
        Map<String, Object> metadata =
                display.hasNonNull("metadata") ? objectMapper.convertValue(display.get("metadata"), MAP_TYPE) : null;
        return new DisplayDataOutput(type, data, metadata);
    }

    /** 作业ID形如 {sessionId}:{cellId}:{timestamp}，同一客户端内时间戳严格递增。 */
    private String nextJobId(String subject) {
        long now = System.currentTimeMillis();
        long timestamp = lastTimestamp.updateAndGet(last -> Math.max(now, last + 1));
        return sessionId + ":" + subject + ":" + timestamp;
    }
}
