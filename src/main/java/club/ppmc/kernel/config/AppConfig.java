/**
 * AppConfig.java
 *
 * 应用级别的Bean配置。
 * 工作池、工作进程启动器与会话注册表都不是 Spring 组件（它们在工作进程和测试中也会被直接构造），
 * 因此在这里根据 SettingsService 提供的当前设置统一创建。
 */
package club.ppmc.kernel.config;

import club.ppmc.kernel.model.KernelEvent;
import club.ppmc.kernel.model.KernelSettings;
import club.ppmc.kernel.pool.JvmWorkerLauncher;
import club.ppmc.kernel.pool.WorkerLauncher;
import club.ppmc.kernel.pool.WorkerPool;
import club.ppmc.kernel.pool.WorkerPoolOptions;
import club.ppmc.kernel.protocol.IpcCodec;
import club.ppmc.kernel.service.SettingsService;
import club.ppmc.kernel.service.WebSocketNotificationService;
import club.ppmc.kernel.session.KernelSessionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class AppConfig {

    /**
     * 与工作进程通信使用的编解码器。它持有独立的 ObjectMapper，
     * 不受 Spring Boot 对全局 ObjectMapper 的定制影响，保证两端的消息格式一致。
     */
    @Bean
    public IpcCodec ipcCodec() {
        return new IpcCodec();
    }

    @Bean
    public WorkerLauncher workerLauncher(SettingsService settingsService) {
        KernelSettings settings = settingsService.getSettings();
        return new JvmWorkerLauncher(settings.getJavaExecutable(), settings.getNpmCommand());
    }

    /**
     * 共享工作池。容量、内存与输出上限在启动时确定，修改后需重启应用；
     * 单作业超时可以通过 KernelSettingsChangedEvent 热更新。
     */
    @Bean(destroyMethod = "close")
    public WorkerPool workerPool(SettingsService settingsService, WorkerLauncher workerLauncher, IpcCodec ipcCodec) {
        WorkerPoolOptions options = WorkerPoolOptions.from(settingsService.getSettings());
        return new WorkerPool(options, workerLauncher, ipcCodec);
    }

    /**
     * 会话注册表。会话的独占进程被替换时，向该会话的主题推送 session_reset 事件。
     */
    @Bean(destroyMethod = "closeAll")
    public KernelSessionRegistry kernelSessionRegistry(
            WorkerPool workerPool, ObjectMapper objectMapper, WebSocketNotificationService notificationService) {
        return new KernelSessionRegistry(workerPool, objectMapper, sessionId -> {
            log.warn("会话 {} 的独占工作进程已被替换，之前定义的变量已丢失", sessionId);
            notificationService.sendKernelEvent(sessionId, KernelEvent.sessionReset());
        });
    }
}
