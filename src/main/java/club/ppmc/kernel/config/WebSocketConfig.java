/**
 * WebSocketConfig.java
 *
 * STOMP over WebSocket 配置。
 * 前端通过 /ws 端点连接，向 /app/kernel/{sessionId}/... 发送执行请求，
 * 并订阅 /topic/kernel/{sessionId} 接收该会话的流式输出与执行结果。
 */
package club.ppmc.kernel.config;

import java.security.Principal;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.server.support.DefaultHandshakeHandler;

@Configuration
@EnableWebSocketMessageBroker
@Slf4j
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    /** 握手时分配给连接的身份，错误回执按它路由到 /user/queue/kernel/errors。 */
    record ConnectionPrincipal(String name) implements Principal {
        @Override
        public String getName() {
            return name;
        }
    }

    static final class ConnectionHandshakeHandler extends DefaultHandshakeHandler {
        @Override
        protected Principal determineUser(
                ServerHttpRequest request, WebSocketHandler wsHandler, Map<String, Object> attributes) {
            var principal = new ConnectionPrincipal("conn-" + UUID.randomUUID());
            log.debug("为来自 {} 的连接分配身份 {}", request.getRemoteAddress(), principal.getName());
            return principal;
        }
    }

    private final long stompHeartbeatMs;
    private final long sockJsHeartbeatMs;
    private final String[] allowedOrigins;

    public WebSocketConfig(
            @Value("${kernel.websocket.stomp-heartbeat-ms:10000}") long stompHeartbeatMs,
            @Value("${kernel.websocket.sockjs-heartbeat-ms:25000}") long sockJsHeartbeatMs,
            @Value("${kernel.web.allowed-origins:*}") String[] allowedOrigins) {
        this.stompHeartbeatMs = stompHeartbeatMs;
        this.sockJsHeartbeatMs = sockJsHeartbeatMs;
        this.allowedOrigins = allowedOrigins;
    }

    /**
     * <p><b>设计思路</b>:
     * 1. <b>/topic</b>: 会话输出、会话重置与工作进程指标的广播。
     * 2. <b>/queue</b>: 经 /user 前缀发给单个连接的错误回执。
     * 3. <b>心跳</b>: 断开的连接会由 WebSocketSessionListener 释放其内核会话，所以需要及时发现失效连接。
     * </p>
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        var heartbeatScheduler = new ThreadPoolTaskScheduler();
        heartbeatScheduler.setPoolSize(1);
        heartbeatScheduler.setThreadNamePrefix("kernel-ws-heartbeat-");
        heartbeatScheduler.initialize();

        config.enableSimpleBroker("/topic", "/queue")
                .setHeartbeatValue(new long[] {stompHeartbeatMs, stompHeartbeatMs})
                .setTaskScheduler(heartbeatScheduler);
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
    }

    /**
     * SockJS 的传输层心跳让长时间运行的单元格不会因代理空闲超时而断开。
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(allowedOrigins)
                .setHandshakeHandler(new ConnectionHandshakeHandler())
                .withSockJS()
                .setHeartbeatTime(sockJsHeartbeatMs);
    }
}
