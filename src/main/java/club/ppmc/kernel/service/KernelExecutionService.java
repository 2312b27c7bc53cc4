/**
 * KernelExecutionService.java
 *
 * 连接 STOMP 接口与内核会话的服务。
 * 它为每个请求找到（或打开）对应的 KernelSessionClient，把执行期间的流式输出
 * 和最终结果转换为 KernelEvent 推送到会话主题。
 *
 * <p><b>事件顺序</b>:
 * status(busy) → 若干 stream/display → execute_reply 或 error → status(idle)。
 * 输出回调来自工作池的读取线程，按工作进程写出的顺序依次到达，结果总在所有输出之后。
 * </p>
 */
package club.ppmc.kernel.service;

import club.ppmc.kernel.exception.KernelJobException;
import club.ppmc.kernel.model.ExecuteCellRequest;
import club.ppmc.kernel.model.ExecutionResult;
import club.ppmc.kernel.model.InvokeHandlerRequest;
import club.ppmc.kernel.model.KernelEvent;
import club.ppmc.kernel.session.KernelSessionClient;
import club.ppmc.kernel.session.KernelSessionRegistry;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class KernelExecutionService {

    static final String STATUS_BUSY = "busy";
    static final String STATUS_IDLE = "idle";

    private final KernelSessionRegistry sessionRegistry;
    private final WebSocketNotificationService notificationService;

    public KernelExecutionService(
            KernelSessionRegistry sessionRegistry, WebSocketNotificationService notificationService) {
        this.sessionRegistry = sessionRegistry;
        this.notificationService = notificationService;
    }

    /**
     * 在会话的独占工作进程中执行一个单元格。
     *
     * @param sessionId 笔记本会话ID。
     * @param ownerId 发起请求的 WebSocket 连接ID，连接断开时据此释放会话。
     * @return 与会话客户端返回的 Future 相同；事件推送不依赖调用方等待它。
     */
    public CompletableFuture<ExecutionResult> execute(String sessionId, String ownerId, ExecuteCellRequest request) {
        String cellId = request.cell().id();
        KernelSessionClient client = sessionRegistry.open(sessionId, ownerId);
        log.debug("会话 {} 执行单元格 {}", sessionId, cellId);
        notificationService.sendKernelEvent(sessionId, KernelEvent.status(cellId, STATUS_BUSY));
        CompletableFuture<ExecutionResult> future =
                client.execute(request, output -> notificationService.sendKernelEvent(sessionId, KernelEvent.output(cellId, output)));
        return publishOutcome(sessionId, cellId, future);
    }

    /**
     * 调用会话中注册的交互处理函数。输出归属到请求中的 cellId（可能为空）。
     */
    public CompletableFuture<ExecutionResult> invoke(String sessionId, String ownerId, InvokeHandlerRequest request) {
        String cellId = request.cellId();
        KernelSessionClient client = sessionRegistry.open(sessionId, ownerId);
        log.debug("会话 {} 调用交互处理函数 {}（事件: {}）", sessionId, request.handlerId(), request.event());
        notificationService.sendKernelEvent(sessionId, KernelEvent.status(cellId, STATUS_BUSY));
        CompletableFuture<ExecutionResult> future =
                client.invokeInteraction(request, output -> notificationService.sendKernelEvent(sessionId, KernelEvent.output(cellId, output)));
        return publishOutcome(sessionId, cellId, future);
    }

    /**
     * @return 会话存在时返回 true（不论当时是否有作业在执行）。
     */
    public boolean cancel(String sessionId) {
        return sessionRegistry.get(sessionId)
                .map(client -> {
                    log.info("取消会话 {} 的当前作业 {}", sessionId, client.getCurrentJobId());
                    client.cancel();
                    return true;
                })
                .orElse(false);
    }

    /**
     * 关闭会话并终止其独占工作进程。
     */
    public boolean close(String sessionId) {
        return sessionRegistry.release(sessionId);
    }

    private CompletableFuture<ExecutionResult> publishOutcome(
            String sessionId, String cellId, CompletableFuture<ExecutionResult> future) {
        return future.whenComplete((result, error) -> {
            if (error == null) {
                notificationService.sendKernelEvent(sessionId, KernelEvent.reply(cellId, result));
            } else {
                notificationService.sendKernelEvent(sessionId, KernelEvent.error(cellId, toErrorData(error)));
            }
            notificationService.sendKernelEvent(sessionId, KernelEvent.status(cellId, STATUS_IDLE));
        });
    }

    static Map<String, Object> toErrorData(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof KernelJobException kernelError) {
            log.info("作业 {} 未能完成: {}", kernelError.getJobId(), kernelError.getMessage());
            return kernelError.toErrorData();
        }
        log.error("执行作业时发生意外错误", cause);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return Map.of("type", "KERNEL_ERROR", "message", message);
    }
}
