/**
 * KernelSettingsListener.java
 *
 * 把设置中可以热更新的项应用到运行中的工作池。
 */
package club.ppmc.kernel.listener;

import club.ppmc.kernel.event.KernelSettingsChangedEvent;
import club.ppmc.kernel.pool.WorkerPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class KernelSettingsListener {

    private final WorkerPool workerPool;

    public KernelSettingsListener(WorkerPool workerPool) {
        this.workerPool = workerPool;
    }

    @EventListener
    public void onSettingsChanged(KernelSettingsChangedEvent event) {
        long timeoutMs = event.current().getPerJobTimeoutMs();
        if (timeoutMs != workerPool.getPerJobTimeoutMs()) {
            workerPool.setPerJobTimeoutMs(timeoutMs);
            log.info("单作业超时已更新为 {}ms", timeoutMs);
        }
        if (event.previous() != null
                && (event.previous().getPoolSize() != event.current().getPoolSize()
                        || event.previous().getMemoryMb() != event.current().getMemoryMb())) {
            log.info("工作池容量或内存设置已修改，将在下次启动时生效");
        }
    }
}
