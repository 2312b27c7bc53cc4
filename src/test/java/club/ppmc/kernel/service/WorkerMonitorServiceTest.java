package club.ppmc.kernel.service;

import club.ppmc.kernel.model.PoolStats;
import club.ppmc.kernel.model.WorkerMetrics;
import club.ppmc.kernel.model.WorkerSnapshot;
import club.ppmc.kernel.pool.WorkerPool;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WorkerMonitorServiceTest {

    private final WorkerPool pool = mock(WorkerPool.class);
    private final WebSocketNotificationService notifications = mock(WebSocketNotificationService.class);
    private final PoolStats stats = new PoolStats(2, 1, 1, 0, 0, 1, 0);

    @Test
    void samplesLiveWorkersOnly() {
        long self = ProcessHandle.current().pid();
        when(pool.stats()).thenReturn(stats);
        when(pool.workers()).thenReturn(List.of(
                new WorkerSnapshot(1, self, false, true, false, "job-1"),
                new WorkerSnapshot(2, 0, false, false, false, null),
                new WorkerSnapshot(3, self, true, false, true, null)));
        var monitor = new WorkerMonitorService(pool, notifications);

        WorkerMetrics metrics = monitor.sample();
        WorkerMetrics second = monitor.sample();

        assertSame(stats, metrics.pool());
        assertEquals(1, metrics.workers().size());
        WorkerMetrics.ProcessUsage usage = second.workers().get(0);
        assertEquals(1, usage.workerId());
        assertEquals(self, usage.pid());
        assertTrue(usage.busy());
        assertTrue(usage.residentBytes() > 0);
        assertTrue(usage.cpuLoad() >= 0);
    }

    @Test
    void pushesMetricsAndSurvivesFailures() {
        when(pool.stats()).thenReturn(stats);
        when(pool.workers()).thenReturn(List.of());
        var monitor = new WorkerMonitorService(pool, notifications);

        monitor.collectAndPushMetrics();
        verify(notifications).sendWorkerMetrics(any(WorkerMetrics.class));

        when(pool.workers()).thenThrow(new IllegalStateException("closed"));
        assertDoesNotThrow(monitor::collectAndPushMetrics);
    }
}
