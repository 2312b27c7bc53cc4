/**
 * KernelController.java
 *
 * 内核的 REST 接口：查看工作池与会话状态，取消或关闭会话。
 * 执行单元格只通过 STOMP（见 KernelMessageController），因为输出需要实时推送。
 */
package club.ppmc.kernel.controller;

import club.ppmc.kernel.model.PoolStats;
import club.ppmc.kernel.model.WorkerSnapshot;
import club.ppmc.kernel.pool.WorkerPool;
import club.ppmc.kernel.service.KernelExecutionService;
import club.ppmc.kernel.session.KernelSessionRegistry;
import club.ppmc.kernel.session.KernelSessionRegistry.SessionInfo;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/kernel")
public class KernelController {

    private final WorkerPool workerPool;
    private final KernelSessionRegistry sessionRegistry;
    private final KernelExecutionService executionService;

    public KernelController(
            WorkerPool workerPool, KernelSessionRegistry sessionRegistry, KernelExecutionService executionService) {
        this.workerPool = workerPool;
        this.sessionRegistry = sessionRegistry;
        this.executionService = executionService;
    }

    @GetMapping("/pool")
    public ResponseEntity<Map<String, Object>> pool() {
        PoolStats stats = workerPool.stats();
        List<WorkerSnapshot> workers = workerPool.workers();
        return ResponseEntity.ok(Map.of(
                "stats", stats,
                "workers", workers,
                "perJobTimeoutMs", workerPool.getPerJobTimeoutMs()));
    }

    @GetMapping("/sessions")
    public ResponseEntity<List<SessionInfo>> sessions() {
        return ResponseEntity.ok(sessionRegistry.sessions());
    }

    /**
     * 取消会话的当前作业。
     */
    @PostMapping("/sessions/{sessionId}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String sessionId) {
        if (!executionService.cancel(sessionId)) {
            return notFound(sessionId);
        }
        return ResponseEntity.ok(Map.of("message", "已向会话的当前作业发送取消请求。"));
    }

    /**
     * 关闭会话并终止其独占工作进程。
     */
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Map<String, String>> close(@PathVariable String sessionId) {
        if (!executionService.close(sessionId)) {
            return notFound(sessionId);
        }
        return ResponseEntity.ok(Map.of("message", "会话已关闭。"));
    }

    private static ResponseEntity<Map<String, String>> notFound(String sessionId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", "会话不存在: " + sessionId));
    }
}
