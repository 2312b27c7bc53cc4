/**
 * KernelSessionRegistry.java
 *
 * 所有打开的内核会话。以会话ID为键，并记录打开它的 WebSocket 连接，
 * 连接断开时释放该连接打开的全部会话，应用关闭时释放全部会话。
 */
package club.ppmc.kernel.session;

import club.ppmc.kernel.pool.WorkerPool;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class KernelSessionRegistry {

    /** 对外展示的会话摘要。 */
    public record SessionInfo(String sessionId, String ownerId, String currentJobId, Instant openedAt) {}

    private record Entry(KernelSessionClient client, String ownerId, Instant openedAt) {}

    private final WorkerPool pool;
    private final ObjectMapper objectMapper;
    private final SessionResetListener resetListener;
    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();

    public KernelSessionRegistry(WorkerPool pool, ObjectMapper objectMapper, SessionResetListener resetListener) {
        this.pool = pool;
        this.objectMapper = objectMapper;
        this.resetListener = resetListener;
    }

    /**
     * 获取会话客户端，不存在时以给定的连接作为所有者创建。
     */
    public KernelSessionClient open(String sessionId, String ownerId) {
        return sessions.computeIfAbsent(sessionId, id -> {
            var client = new KernelSessionClient(id, pool, objectMapper);
            client.setResetListener(resetListener);
            log.info("已打开内核会话 {}（连接: {}）", id, ownerId);
            return new Entry(client, ownerId, Instant.now());
        }).client();
    }

    public Optional<KernelSessionClient> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(Entry::client);
    }

    /**
     * @return 会话存在并已释放时返回 true。
     */
    public boolean release(String sessionId) {
        Entry entry = sessions.remove(sessionId);
        if (entry == null) {
            return false;
        }
        entry.client().release();
        log.info("内核会话 {} 已关闭", sessionId);
        return true;
    }

    /** 释放某个连接打开的全部会话，返回释放的数量。 */
    public int releaseByOwner(String ownerId) {
        int count = 0;
        for (var item : List.copyOf(sessions.entrySet())) {
            if (ownerId.equals(item.getValue().ownerId()) && release(item.getKey())) {
                count++;
            }
        }
        return count;
    }

    public List<SessionInfo> sessions() {
        return sessions.entrySet().stream()
                .map(item -> new SessionInfo(
                        item.getKey(),
                        item.getValue().ownerId(),
                        item.getValue().client().getCurrentJobId(),
                        item.getValue().openedAt()))
                .sorted(Comparator.comparing(SessionInfo::openedAt))
                .toList();
    }

    public void closeAll() {
        List.copyOf(sessions.keySet()).forEach(this::release);
    }
}
