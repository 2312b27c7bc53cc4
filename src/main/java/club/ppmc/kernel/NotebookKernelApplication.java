/**
 * NotebookKernelApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动笔记本内核服务：工作池、会话注册表以及 STOMP/REST 接口。
 * @EnableScheduling 注解用于启用Spring的定时任务功能，供 WorkerMonitorService 使用。
 * 工作进程本身不经过这里，其入口是 club.ppmc.kernel.worker.WorkerMain。
 */
package club.ppmc.kernel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NotebookKernelApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotebookKernelApplication.class, args);
    }
}
