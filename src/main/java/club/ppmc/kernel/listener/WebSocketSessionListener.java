/**
 * WebSocketSessionListener.java
 *
 * Spring事件监听器，处理WebSocket的连接和断开事件。
 * 连接断开（无论是正常关闭还是意外掉线）时，释放该连接打开的全部内核会话，
 * 避免其独占的工作进程一直存活。
 */
package club.ppmc.kernel.listener;

import club.ppmc.kernel.session.KernelSessionRegistry;
import java.security.Principal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Component
@Slf4j
public class WebSocketSessionListener {

    private final KernelSessionRegistry sessionRegistry;

    public WebSocketSessionListener(KernelSessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    @EventListener
    public void handleWebSocketConnectListener(SessionConnectedEvent event) {
        var headerAccessor = StompHeaderAccessor.wrap(event.getMessage());
        Principal user = headerAccessor.getUser();
        log.info("接收到新的 WebSocket 连接，会话 ID: {}，用户: {}",
                headerAccessor.getSessionId(), user != null ? user.getName() : "匿名");
    }

    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        String connectionId = event.getSessionId();
        if (connectionId == null) {
            return;
        }
        int released = sessionRegistry.releaseByOwner(connectionId);
        log.info("WebSocket 连接断开，会话 ID: {}，释放了 {} 个内核会话", connectionId, released);
    }
}
