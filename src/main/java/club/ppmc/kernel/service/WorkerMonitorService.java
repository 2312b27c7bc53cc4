/**
 * WorkerMonitorService.java
 *
 * 周期性地采集工作池中每个工作进程的 CPU 与常驻内存，
 * 连同工作池统计一起通过WebSocket推送到前端。
 * 它依赖于 Oshi 库进行跨平台的进程信息获取。
 */
package club.ppmc.kernel.service;

import club.ppmc.kernel.model.WorkerMetrics;
import club.ppmc.kernel.model.WorkerMetrics.ProcessUsage;
import club.ppmc.kernel.model.WorkerSnapshot;
import club.ppmc.kernel.pool.WorkerPool;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import oshi.SystemInfo;
import oshi.software.os.OSProcess;
import oshi.software.os.OperatingSystem;

@Service
@Slf4j
public class WorkerMonitorService {

    private final WorkerPool workerPool;
    private final WebSocketNotificationService notificationService;
    private final OperatingSystem operatingSystem;

    // 上一次采样的进程快照，用于计算两次采样之间的CPU使用率
    private final Map<Long, OSProcess> previousSamples = new HashMap<>();

    public WorkerMonitorService(WorkerPool workerPool, WebSocketNotificationService notificationService) {
        this.workerPool = workerPool;
        this.notificationService = notificationService;
        this.operatingSystem = new SystemInfo().getOperatingSystem();
    }

    /**
     * 定时任务，每2秒执行一次。
     */
    @Scheduled(fixedRate = 2000)
    public void collectAndPushMetrics() {
        try {
            notificationService.sendWorkerMetrics(sample());
        } catch (Exception e) {
            log.error("采集或推送工作进程指标时出错", e);
        }
    }

    synchronized WorkerMetrics sample() {
        List<WorkerSnapshot> workers = workerPool.workers();
        var usages = new ArrayList<ProcessUsage>();
        var seen = new HashMap<Long, OSProcess>();
        for (WorkerSnapshot worker : workers) {
            if (worker.pid() <= 0 || worker.crashed()) {
                continue;
            }
            OSProcess process = operatingSystem.getProcess((int) worker.pid());
            if (process == null) {
                // 进程已在两次采样之间退出
                continue;
            }
            OSProcess previous = previousSamples.get(worker.pid());
            double cpuLoad = previous != null
                    ? process.getProcessCpuLoadBetweenTicks(previous) * 100.0
                    : process.getProcessCpuLoadCumulative() * 100.0;
            usages.add(new ProcessUsage(
                    worker.workerId(), worker.pid(), worker.busy(), cpuLoad, process.getResidentSetSize()));
            seen.put(worker.pid(), process);
        }
        previousSamples.clear();
        previousSamples.putAll(seen);
        return new WorkerMetrics(workerPool.stats(), usages, System.currentTimeMillis());
    }
}
