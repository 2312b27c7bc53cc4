/**
 * JvmWorkerLauncher.java
 *
 * 以独立 JVM 启动工作进程。子进程复用当前应用的类路径，入口为 WorkerMain，
 * 通过 -Xmx 限制堆大小，内存耗尽时直接退出，由工作池按崩溃处理。
 * 当应用以 Spring Boot 可执行 jar 运行时，改用 PropertiesLauncher 加载嵌套的依赖 jar。
 */
package club.ppmc.kernel.pool;

import club.ppmc.kernel.exception.WorkerSpawnException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.zip.ZipFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

@Slf4j
public class JvmWorkerLauncher implements WorkerLauncher {

    static final String WORKER_MAIN_CLASS = "club.ppmc.kernel.worker.WorkerMain";
    private static final String BOOT_LAUNCHER_CLASS = "org.springframework.boot.loader.launch.PropertiesLauncher";

    private final String javaExecutable;
    private final String classPath;
    private final String npmCommand;

    public JvmWorkerLauncher(String javaExecutable, String npmCommand) {
        this(javaExecutable, System.getProperty("java.class.path"), npmCommand);
    }

    JvmWorkerLauncher(String javaExecutable, String classPath, String npmCommand) {
        this.javaExecutable = StringUtils.hasText(javaExecutable) ? javaExecutable : currentJavaExecutable();
        this.classPath = classPath;
        this.npmCommand = StringUtils.hasText(npmCommand) ? npmCommand : "npm";
    }

    @Override
    public WorkerProcess launch(int workerId, WorkerPoolOptions options) {
        List<String> command = buildCommand(workerId, options);
        Path workspace = options.getWorkspaceRoot().resolve("worker-" + workerId);
        try {
            Files.createDirectories(workspace);
            Process process = new ProcessBuilder(command).directory(workspace.toFile()).start();
            log.info("已启动工作进程 worker-{}，PID: {}", workerId, process.pid());
            return new JvmWorkerProcess(process);
        } catch (IOException e) {
            throw new WorkerSpawnException("启动工作进程失败: " + e.getMessage(), e);
        }
    }

    List<String> buildCommand(int workerId, WorkerPoolOptions options) {
        Path workspace = options.getWorkspaceRoot().resolve("worker-" + workerId);
        var command = new ArrayList<String>();
        command.add(javaExecutable);
        command.add("-Xmx" + options.getMemoryMb() + "m");
        command.add("-XX:+ExitOnOutOfMemoryError");
        command.add("-XX:+UseSerialGC");
        command.add("-XX:TieredStopAtLevel=1");
        command.add("-Dfile.encoding=UTF-8");
        command.add("-Dlogback.configurationFile=kernel-worker-logback.xml");
        command.add("-Dkernel.worker.id=" + workerId);
        command.add("-Dkernel.worker.batch-ms=" + options.getBatchMs());
        command.add("-Dkernel.worker.max-frame-bytes=" + Math.min(Integer.MAX_VALUE, options.getMaxOutputBytes()));
        command.add("-Dkernel.worker.workspace=" + workspace.toAbsolutePath());
        command.add("-Dkernel.worker.npm=" + npmCommand);
        if (isBootJar(classPath)) {
            command.add("-Dloader.main=" + WORKER_MAIN_CLASS);
            command.add("-cp");
            command.add(classPath);
            command.add(BOOT_LAUNCHER_CLASS);
        } else {
            command.add("-cp");
            command.add(classPath);
            command.add(WORKER_MAIN_CLASS);
        }
        return command;
    }

    private static boolean isBootJar(String classPath) {
        if (classPath == null || classPath.contains(File.pathSeparator) || !classPath.endsWith(".jar")) {
            return false;
        }
        try (var jar = new ZipFile(classPath)) {
            return jar.getEntry("BOOT-INF/") != null || jar.getEntry("BOOT-INF/classes/") != null;
        } catch (IOException e) {
            log.debug("无法检查类路径 {}: {}", classPath, e.getMessage());
            return false;
        }
    }

    private static String currentJavaExecutable() {
        String executable = System.getProperty("os.name", "").toLowerCase().contains("win") ? "java.exe" : "java";
        return Paths.get(System.getProperty("java.home"), "bin", executable).toString();
    }

    /** 对 java.lang.Process 的包装。 */
    static class JvmWorkerProcess implements WorkerProcess {

        private final Process process;

        JvmWorkerProcess(Process process) {
            this.process = process;
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public OutputStream stdin() {
            return process.getOutputStream();
        }

        @Override
        public InputStream stdout() {
            return process.getInputStream();
        }

        @Override
        public InputStream stderr() {
            return process.getErrorStream();
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return process.onExit().thenApply(Process::exitValue);
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void kill() {
            // npm install 等子进程也一并结束
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }
}
