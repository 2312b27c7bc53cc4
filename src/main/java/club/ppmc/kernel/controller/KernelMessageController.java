/**
 * KernelMessageController.java
 *
 * 一个WebSocket控制器，监听来自笔记本前端的 STOMP 消息。
 * 执行结果不作为返回值回送，而是由 KernelExecutionService 推送到 /topic/kernel/{sessionId}，
 * 这样同一会话的所有订阅者（例如协作者）都能看到输出。
 */
package club.ppmc.kernel.controller;

import club.ppmc.kernel.model.ExecuteCellRequest;
import club.ppmc.kernel.model.InvokeHandlerRequest;
import club.ppmc.kernel.service.KernelExecutionService;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

@Controller
@Slf4j
public class KernelMessageController {

    private final KernelExecutionService executionService;

    public KernelMessageController(KernelExecutionService executionService) {
        this.executionService = executionService;
    }

    /**
     * 执行单元格。
     *
     * @param sessionId 笔记本会话ID。
     * @param request 单元格源码与运行环境。
     * @param headerAccessor 用于获取发起请求的 WebSocket 连接ID。
     */
    @MessageMapping("/kernel/{sessionId}/execute")
    public void execute(
            @DestinationVariable String sessionId,
            @Payload @Valid ExecuteCellRequest request,
            SimpMessageHeaderAccessor headerAccessor) {
        executionService.execute(sessionId, headerAccessor.getSessionId(), request);
    }

    @MessageMapping("/kernel/{sessionId}/invoke")
    public void invoke(
            @DestinationVariable String sessionId,
            @Payload @Valid InvokeHandlerRequest request,
            SimpMessageHeaderAccessor headerAccessor) {
        executionService.invoke(sessionId, headerAccessor.getSessionId(), request);
    }

    @MessageMapping("/kernel/{sessionId}/cancel")
    public void cancel(@DestinationVariable String sessionId) {
        executionService.cancel(sessionId);
    }

    /**
     * 请求体校验失败时，只回复给发起请求的连接。
     */
    @MessageExceptionHandler(MethodArgumentNotValidException.class)
    @SendToUser(destinations = "/queue/kernel/errors", broadcast = false)
    public Map<String, String> handleInvalidRequest(MethodArgumentNotValidException e) {
        log.warn("收到无效的内核请求: {}", e.getMessage());
        return Map.of("type", "INVALID_REQUEST", "message", e.getMessage());
    }
}
