/**
 * SystemCommandExecutor.java
 *
 * 负责异步执行外部系统命令的工具类，工作进程用它为笔记本安装依赖（npm install）。
 * 它接受一个命令列表（而不是单个字符串）以避免因路径中存在空格而导致的解析问题。
 * 执行结果通过 CompletableFuture 返回，输出逐行交给消费者；取消返回的 Future 会终止整个进程树。
 */
package club.ppmc.kernel.util;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SystemCommandExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemCommandExecutor.class);

    /**
     * 异步执行一个系统命令，并实时流式传输其合并后的标准输出和错误流。
     *
     * @param commandList 要执行的命令及其参数列表 (e.g., ["npm", "install"])。
     * @param workingDirectory 命令执行的工作目录。
     * @param outputConsumer 处理命令输出每一行的消费者。
     * @return 进程结束时完成的 Future，其值为退出码；无法启动时以异常完成。
     */
    public CompletableFuture<Integer> executeCommand(
            List<String> commandList, File workingDirectory, Consumer<String> outputConsumer) {
        if (commandList == null || commandList.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("执行的命令不能为空"));
        }
        var processRef = new AtomicReference<Process>();
        CompletableFuture<Integer> future =
                CompletableFuture.supplyAsync(
                        () -> {
                            try {
                                LOGGER.info(
                                        "在目录 {} 中执行命令: {}",
                                        workingDirectory.getAbsolutePath(),
                                        String.join(" ", commandList));

                                var process =
                                        new ProcessBuilder(commandList)
                                                .directory(workingDirectory)
                                                .redirectErrorStream(true)
                                                .start();
                                processRef.set(process);

                                try (var reader =
                                        new BufferedReader(
                                                new InputStreamReader(
                                                        process.getInputStream(), StandardCharsets.UTF_8))) {
                                    reader.lines().forEach(outputConsumer);
                                }

                                int exitCode = process.waitFor();
                                LOGGER.info("命令执行完毕，退出码: {}", exitCode);
                                return exitCode;
                            } catch (IOException e) {
                                throw new CommandExecutionException(
                                        "无法执行命令 " + commandList.get(0) + ": " + e.getMessage(), e);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                                throw new CommandExecutionException("命令执行被中断", e);
                            }
                        });
        future.whenComplete(
                (exitCode, error) -> {
                    Process process = processRef.get();
                    if (future.isCancelled() && process != null && process.isAlive()) {
                        LOGGER.info("命令已取消，终止进程 {}", process.pid());
                        process.descendants().forEach(ProcessHandle::destroyForcibly);
                        process.destroyForcibly();
                    }
                });
        return future;
    }

    /** 命令无法启动或等待过程被中断。 */
    public static class CommandExecutionException extends RuntimeException {

        public CommandExecutionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
