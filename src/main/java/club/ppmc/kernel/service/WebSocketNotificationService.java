/**
 * WebSocketNotificationService.java
 *
 * 统一的WebSocket消息发送服务，封装了 SimpMessagingTemplate 的使用细节。
 * 内核事件发送到 /topic/kernel/{sessionId}，工作进程指标发送到 /topic/kernel/workers。
 */
package club.ppmc.kernel.service;

import club.ppmc.kernel.model.KernelEvent;
import club.ppmc.kernel.model.WorkerMetrics;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class WebSocketNotificationService {

    static final String WORKER_METRICS_TOPIC = "/topic/kernel/workers";

    private final SimpMessagingTemplate messagingTemplate;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    /**
     * 发送一个内核事件到会话的主题。
     * @param sessionId 笔记本会话ID（不是 WebSocket 连接ID）。
     */
    public void sendKernelEvent(String sessionId, KernelEvent event) {
        sendMessage(kernelTopic(sessionId), event);
    }

    public void sendWorkerMetrics(WorkerMetrics metrics) {
        sendMessage(WORKER_METRICS_TOPIC, metrics);
    }

    /**
     * 向指定的WebSocket主题发送一个通用载荷(payload)，由框架序列化为JSON。
     */
    public void sendMessage(String destination, Object payload) {
        messagingTemplate.convertAndSend(destination, payload);
    }

    static String kernelTopic(String sessionId) {
        return "/topic/kernel/" + sessionId;
    }
}
