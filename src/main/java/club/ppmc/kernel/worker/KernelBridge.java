/**
 * KernelBridge.java
 *
 * 暴露给用户代码的唯一宿主对象。只有标注了 @HostAccess.Export 的方法可以被 JavaScript 调用。
 * 预加载脚本拿到它之后把它藏在闭包里，用户代码看到的是 console、display、setTimeout、fs 等包装。
 * 文件操作以 JSON 信封 {"value": ...} 或 {"error": "..."} 返回，由预加载脚本转换为 JavaScript 异常。
 */
package club.ppmc.kernel.worker;

import club.ppmc.kernel.protocol.FrameKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.Value;

@Slf4j
public class KernelBridge {

    @FunctionalInterface
    private interface FileAction {
        Object apply(Path path) throws IOException;
    }

    private final EventLoop eventLoop;
    private final SandboxPaths paths;
    private final ObjectMapper objectMapper;
    private volatile ConsoleBuffer console;

    KernelBridge(EventLoop eventLoop, SandboxPaths paths, ObjectMapper objectMapper) {
        this.eventLoop = eventLoop;
        this.paths = paths;
        this.objectMapper = objectMapper;
    }

    void attach(ConsoleBuffer console) {
        this.console = console;
    }

    void detach() {
        this.console = null;
    }

    // --- 输出 ---

    @HostAccess.Export
    public void write(int stream, String text) {
        ConsoleBuffer buffer = console;
        if (buffer != null && text != null) {
            buffer.write(stream == 2 ? FrameKind.STDERR : FrameKind.STDOUT, text);
        }
    }

    @HostAccess.Export
    public void display(String json) {
        ConsoleBuffer buffer = console;
        if (buffer != null && json != null) {
            buffer.display(json.getBytes(StandardCharsets.UTF_8));
        }
    }

    // --- 计时器 ---

    @HostAccess.Export
    public int setTimer(Value callback, double delayMs, boolean repeat) {
        if (callback == null || !callback.canExecute()) {
            throw new IllegalArgumentException("Timer callback must be a function");
        }
        long delay = Double.isNaN(delayMs) || delayMs < 0 ? 0 : (long) delayMs;
        return eventLoop.schedule(callback, delay, repeat);
    }

    @HostAccess.Export
    public void clearTimer(int id) {
        eventLoop.clear(id);
    }

    // --- 沙箱文件系统 ---

    @HostAccess.Export
    public String cwd() {
        return paths.root().toString();
    }

    @HostAccess.Export
    public String readFile(String path) {
        return fileCall(path, file -> Files.readString(file, StandardCharsets.UTF_8));
    }

    @HostAccess.Export
    public String writeFile(String path, String content, boolean append) {
        return fileCall(path, file -> {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            if (append) {
                Files.writeString(file, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                Files.writeString(file, content, StandardCharsets.UTF_8);
            }
            return null;
        });
    }

    @HostAccess.Export
    public String exists(String path) {
        return fileCall(path, Files::exists);
    }

    @HostAccess.Export
    public String readdir(String path) {
        return fileCall(path, dir -> {
            try (Stream<Path> entries = Files.list(dir)) {
                return entries.map(entry -> entry.getFileName().toString()).sorted().toList();
            }
        });
    }

    @HostAccess.Export
    public String stat(String path) {
        return fileCall(path, file -> {
            var stat = new LinkedHashMap<String, Object>();
            stat.put("size", Files.size(file));
            stat.put("isFile", Files.isRegularFile(file));
            stat.put("isDirectory", Files.isDirectory(file));
            stat.put("mtimeMs", Files.getLastModifiedTime(file).toMillis());
            return stat;
        });
    }

    @HostAccess.Export
    public String mkdir(String path) {
        return fileCall(path, dir -> {
            Files.createDirectories(dir);
            return null;
        });
    }

    @HostAccess.Export
    public String remove(String path) {
        return fileCall(path, file -> {
            if (file.equals(paths.root())) {
                throw new SecurityException(SandboxPaths.deniedMessage(path));
            }
            if (Files.isDirectory(file)) {
                FileUtils.deleteDirectory(file.toFile());
            } else {
                Files.delete(file);
            }
            return null;
        });
    }

    private String fileCall(String input, FileAction action) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        try {
            envelope.put("value", action.apply(paths.resolve(input)));
        } catch (SecurityException e) {
            envelope.put("error", e.getMessage());
        } catch (NoSuchFileException e) {
            envelope.put("error", "ENOENT: no such file or directory, '" + input + "'");
        } catch (IOException | RuntimeException e) {
            log.debug("沙箱文件操作失败: {}", e.toString());
            envelope.put("error", e.getMessage() != null ? e.getMessage() : e.toString());
        }
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            return "{\"error\":\"Failed to encode file system result\"}";
        }
    }
}
