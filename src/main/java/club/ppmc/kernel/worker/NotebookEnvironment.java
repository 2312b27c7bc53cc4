/**
 * NotebookEnvironment.java
 *
 * 负责为每个笔记本准备独立的沙箱目录及其 npm 依赖。
 *
 * <p><b>设计思路</b>:
 *
 * <ul>
 *   <li>沙箱目录位于工作进程的工作区下，以清洗后的笔记本ID命名。
 *   <li>已安装的依赖集合以一个排序后的键记录在 {@code .kernel-env.json} 中，键不变时跳过安装。
 *   <li>依赖变化时重写 {@code package.json} 并执行 {@code npm install}，输出逐行转发给调用方。
 *   <li>依赖集合为空时删除 {@code node_modules}。
 * </ul>
 */
package club.ppmc.kernel.worker;

import club.ppmc.kernel.model.NotebookEnv;
import club.ppmc.kernel.util.SystemCommandExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

@Slf4j
public class NotebookEnvironment {

    static final String STATE_FILE = ".kernel-env.json";
    private static final long POLL_INTERVAL_MS = 100;

    private final Path workspaceRoot;
    private final String npmCommand;
    private final SystemCommandExecutor commandExecutor;
    private final ObjectMapper objectMapper;

    public NotebookEnvironment(
            Path workspaceRoot, String npmCommand, SystemCommandExecutor commandExecutor, ObjectMapper objectMapper) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        this.npmCommand = npmCommand;
        this.commandExecutor = commandExecutor;
        this.objectMapper = objectMapper;
    }

    /**
     * 返回笔记本的沙箱目录，不存在时创建。
     */
    public Path sandboxFor(String notebookId) throws IOException {
        Path dir = workspaceRoot.resolve(sanitize(notebookId));
        Files.createDirectories(dir);
        return dir;
    }

    static String sanitize(String notebookId) {
        String cleaned = notebookId == null ? "" : notebookId.replaceAll("[^A-Za-z0-9._-]", "_");
        if (cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("..")) {
            return "default";
        }
        return cleaned;
    }

    static String packagesKey(Map<String, String> packages) {
        return new TreeMap<>(packages)
                .entrySet().stream()
                        .map(entry -> entry.getKey() + "@" + entry.getValue())
                        .collect(Collectors.joining(","));
    }

    /**
     * 确保沙箱中安装的依赖与声明一致。
     *
     * @param progress 接收安装过程的输出行。
     * @return 是否实际执行了安装或清理。
     * @throws DependencyInstallException 安装失败。
     * @throws JobStoppedException 安装期间作业被取消或超时，npm 进程随之终止。
     */
    public boolean prepare(Path sandbox, NotebookEnv env, Consumer<String> progress, CancellationToken token)
            throws DependencyInstallException {
        String key = packagesKey(env.packages());
        Path stateFile = sandbox.resolve(STATE_FILE);
        if (key.equals(readInstalledKey(stateFile))) {
            return false;
        }
        try {
            if (env.packages().isEmpty()) {
                FileUtils.deleteDirectory(sandbox.resolve("node_modules").toFile());
                Files.deleteIfExists(sandbox.resolve("package.json"));
            } else {
                writePackageJson(sandbox, env.packages());
                progress.accept("Installing " + key.replace(",", ", "));
                runInstall(sandbox, progress, token);
            }
            writeInstalledKey(stateFile, key);
        } catch (IOException e) {
            throw new DependencyInstallException(e.getMessage(), e);
        }
        return true;
    }

    private void runInstall(Path sandbox, Consumer<String> progress, CancellationToken token)
            throws DependencyInstallException {
        CompletableFuture<Integer> install =
                commandExecutor.executeCommand(
                        List.of(npmCommand, "install", "--no-audit", "--no-fund"), sandbox.toFile(), progress);
        int exitCode;
        try {
            exitCode = awaitInstall(install, token);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new DependencyInstallException(cause.getMessage(), cause);
        }
        if (exitCode != 0) {
            throw new DependencyInstallException(npmCommand + " install exited with code " + exitCode);
        }
    }

    private static int awaitInstall(CompletableFuture<Integer> install, CancellationToken token)
            throws ExecutionException {
        while (true) {
            if (token.isStopped()) {
                install.cancel(true);
                throw new JobStoppedException();
            }
            try {
                return install.get(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // 继续轮询停止信号
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                install.cancel(true);
                throw new JobStoppedException();
            }
        }
    }

    private void writePackageJson(Path sandbox, Map<String, String> packages) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("name", "notebook-sandbox");
        root.put("private", true);
        ObjectNode dependencies = root.putObject("dependencies");
        new TreeMap<>(packages).forEach(dependencies::put);
        Files.writeString(sandbox.resolve("package.json"), objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root));
    }

    private String readInstalledKey(Path stateFile) {
        if (!Files.exists(stateFile)) {
            return "";
        }
        try {
            return objectMapper.readTree(stateFile.toFile()).path("packagesKey").asText("");
        } catch (IOException e) {
            log.warn("无法读取依赖状态文件 {}，将重新安装", stateFile, e);
            return null;
        }
    }

    private void writeInstalledKey(Path stateFile, String key) throws IOException {
        objectMapper.writeValue(stateFile.toFile(), Map.of("packagesKey", key));
    }
}
