/**
 * NotebookRuntime.java
 *
 * 工作进程中执行笔记本代码的核心。每个笔记本对应一个 GraalJS 上下文，
 * 同一笔记本的作业复用该上下文（REPL 式的全局状态延续），切换到其他笔记本时关闭旧上下文并新建。
 *
 * <p><b>设计思路</b>:
 *
 * <ul>
 *   <li>上下文只开放 {@link KernelBridge} 上显式导出的方法，禁止宿主类查找、本地访问、创建线程与进程。
 *   <li>文件访问（CommonJS require 与 fs 辅助函数）限定在笔记本的沙箱目录内。
 *   <li>每个作业有独立的 {@link ConsoleBuffer} 与 {@link CancellationToken}；超时与取消通过
 *       {@code Context.interrupt} 打断正在运行的脚本，等待计时器时则由令牌直接唤醒。
 *   <li>计时器回调只在执行线程上运行，作业结束时未触发的计时器全部丢弃。
 * </ul>
 */
package club.ppmc.kernel.worker;

import club.ppmc.kernel.model.ErrorOutput;
import club.ppmc.kernel.model.ExecutionError;
import club.ppmc.kernel.model.ExecutionRecord;
import club.ppmc.kernel.model.ExecutionResult;
import club.ppmc.kernel.model.ExecutionStatus;
import club.ppmc.kernel.model.NotebookEnv;
import club.ppmc.kernel.model.NotebookOutput;
import club.ppmc.kernel.protocol.FrameKind;
import club.ppmc.kernel.protocol.InvokeHandlerMessage;
import club.ppmc.kernel.protocol.RunCellMessage;
import club.ppmc.kernel.util.SystemCommandExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;

@Slf4j
public class NotebookRuntime implements AutoCloseable {

    private static final String PRELUDE_RESOURCE = "/kernel/prelude.js";
    private static final long INTERRUPT_SLICE_MS = 100;
    private static final long INTERRUPTER_JOIN_MS = 2_000;

    /** 一次对用户代码的调用，返回需要等待的值。 */
    @FunctionalInterface
    private interface GuestCall {
        Value run() throws IOException;
    }

    private final RuntimeOptions options;
    private final OutputSink sink;
    private final ScheduledExecutorService scheduler;
    private final ObjectMapper objectMapper;
    private final NotebookEnvironment environment;
    private final JobConsoleStream out = new JobConsoleStream(FrameKind.STDOUT);
    private final JobConsoleStream err = new JobConsoleStream(FrameKind.STDERR);

    private String notebookId;
    private Path sandbox;
    private Context context;
    private Value internals;
    private EventLoop eventLoop;
    private KernelBridge bridge;

    public NotebookRuntime(
            RuntimeOptions options, OutputSink sink, ScheduledExecutorService scheduler, ObjectMapper objectMapper) {
        this(options, sink, scheduler, objectMapper, new SystemCommandExecutor());
    }

    public NotebookRuntime(
            RuntimeOptions options,
            OutputSink sink,
            ScheduledExecutorService scheduler,
            ObjectMapper objectMapper,
            SystemCommandExecutor commandExecutor) {
        this.options = options;
        this.sink = sink;
        this.scheduler = scheduler;
        this.objectMapper = objectMapper;
        this.environment =
                new NotebookEnvironment(options.workspaceRoot(), options.npmCommand(), commandExecutor, objectMapper);
    }

    /**
     * 执行一个单元格。用户代码的错误、超时与取消都体现在返回结果中，不会抛出。
     *
     * @throws IllegalStateException 运行时自身出现内部错误，调用方应报告为工作进程失败。
     */
    public ExecutionResult runCell(RunCellMessage message, CancellationToken token) {
        long started = System.currentTimeMillis();
        Optional<Transpiler> transpiler = Transpiler.forLanguage(message.cell().language());
        if (transpiler.isEmpty()) {
            return failure(started, ExecutionStatus.ERROR, ExecutionError.of(
                    "UnsupportedLanguageError", "Unsupported cell language: " + message.cell().language()));
        }
        String sourceName = message.cell().id() + "." + transpiler.get().fileExtension();
        return execute(message.notebookId(), message.env(), message.globals(), message.timeoutMs(), sourceName,
                token, started, () -> {
                    String code = CellSourceRewriter.rewrite(transpiler.get().transpile(message.code()));
                    return context.eval(Source.newBuilder("js", code, sourceName).buildLiteral());
                });
    }

    /**
     * 调用通过 registerHandler 注册的交互处理函数，返回值与单元格一样会被等待和展示。
     */
    public ExecutionResult invokeHandler(InvokeHandlerMessage message, CancellationToken token) {
        long started = System.currentTimeMillis();
        String sourceName = (message.cellId() != null ? message.cellId() : "handler") + ".js";
        return execute(message.notebookId(), message.env(), message.globals(), message.timeoutMs(), sourceName,
                token, started, () -> {
                    ObjectNode handlerContext = objectMapper.createObjectNode();
                    handlerContext.put("event", message.event());
                    handlerContext.set("payload", message.payload());
                    handlerContext.put("componentId", message.componentId());
                    handlerContext.put("cellId", message.cellId());
                    return internals.invokeMember(
                            "invoke", message.handlerId(), objectMapper.writeValueAsString(handlerContext));
                });
    }

    private ExecutionResult execute(
            String notebook,
            NotebookEnv env,
            Map<String, Object> globals,
            Long requestedTimeoutMs,
            String sourceName,
            CancellationToken token,
            long started,
            GuestCall call) {
        long timeoutMs = requestedTimeoutMs != null && requestedTimeoutMs > 0
                ? requestedTimeoutMs
                : options.defaultTimeoutMs();
        long deadline = started + timeoutMs;
        var console = new ConsoleBuffer(sink);
        var interrupter = new AtomicReference<Thread>();

        ScheduledFuture<?> flusher = scheduler.scheduleAtFixedRate(
                console::flush, options.batchMs(), options.batchMs(), TimeUnit.MILLISECONDS);
        ScheduledFuture<?> watchdog = scheduler.schedule(token::timeout, timeoutMs, TimeUnit.MILLISECONDS);

        List<NotebookOutput> outputs = new ArrayList<>();
        try {
            ensureContext(notebook);
            Context current = context;
            token.onStop(state -> {
                if (state == CancellationToken.State.CANCELLED) {
                    console.discardFurther();
                }
                Thread thread = new Thread(() -> interruptUntilFinished(current, token), "kernel-interrupt");
                thread.setDaemon(true);
                interrupter.set(thread);
                thread.start();
            });
            out.attach(console);
            err.attach(console);
            bridge.attach(console);
            checkStopped(token);

            environment.prepare(sandbox, env,
                    line -> console.write(FrameKind.STDOUT, "[env] " + line + "\n"), token);
            internals.invokeMember("setEnv", objectMapper.writeValueAsString(env.variables()));
            if (globals != null && !globals.isEmpty()) {
                internals.invokeMember("setGlobals", objectMapper.writeValueAsString(globals));
            }
            internals.invokeMember("setModule", sandbox.resolve(sourceName).toString(), sandbox.toString());

            Value value = awaitValue(call.run(), deadline, token);
            eventLoop.drain(deadline, token);
            checkStopped(token);

            Value display = internals.invokeMember("toDisplay", value);
            if (display != null && !display.isNull()) {
                outputs.add(objectMapper.readValue(display.asString(), NotebookOutput.class));
            }
            return new ExecutionResult(outputs, ExecutionRecord.ok(started, System.currentTimeMillis()));
        } catch (JobStoppedException e) {
            return stopped(started, timeoutMs, token, console);
        } catch (PolyglotException e) {
            if (token.isStopped() || e.isInterrupted() || e.isCancelled()) {
                return stopped(started, timeoutMs, token, console);
            }
            if (e.isInternalError()) {
                throw new IllegalStateException("GraalJS 内部错误: " + e.getMessage(), e);
            }
            return failure(started, ExecutionStatus.ERROR, describe(e));
        } catch (GuestRejectionException e) {
            return failure(started, ExecutionStatus.ERROR, e.error);
        } catch (DependencyInstallException e) {
            return failure(started, ExecutionStatus.ERROR, ExecutionError.of(
                    "DependencyInstallError", "Failed to install notebook dependencies: " + e.getMessage()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            flusher.cancel(false);
            watchdog.cancel(false);
            token.finish();
            joinInterrupter(interrupter.get());
            if (eventLoop != null) {
                eventLoop.clearAll();
            }
            console.flushAll();
            out.detach();
            err.detach();
            if (bridge != null) {
                bridge.detach();
            }
        }
    }

    /**
     * 等待求值结果：thenable 在事件循环上等待其完成，普通值直接返回。
     * 既未完成又没有待触发计时器的 Promise 永远不会完成，此时结果视为 undefined。
     */
    private Value awaitValue(Value value, long deadline, CancellationToken token) {
        Value state = internals.invokeMember("track", value);
        boolean done = eventLoop.runUntil(() -> state.getMember("done").asBoolean(), deadline, token);
        if (!done) {
            return context.eval("js", "undefined");
        }
        if (!state.getMember("ok").asBoolean()) {
            throw new GuestRejectionException(describeGuestValue(state.getMember("error")));
        }
        return state.getMember("value");
    }

    private static void checkStopped(CancellationToken token) {
        if (token.isStopped()) {
            throw new JobStoppedException();
        }
    }

    private ExecutionResult stopped(long started, long timeoutMs, CancellationToken token, ConsoleBuffer console) {
        ExecutionError error;
        if (token.state() == CancellationToken.State.CANCELLED) {
            error = ExecutionError.of("CancelledError", "Execution cancelled");
        } else {
            console.write(FrameKind.STDERR, "[timeout] Execution exceeded " + timeoutMs + "ms and was stopped.\n");
            error = ExecutionError.of("TimeoutError", "Execution exceeded " + timeoutMs + "ms");
        }
        return failure(started, ExecutionStatus.ABORTED, error);
    }

    private static ExecutionResult failure(long started, ExecutionStatus status, ExecutionError error) {
        var record = new ExecutionRecord(started, System.currentTimeMillis(), status, error);
        return new ExecutionResult(List.of(ErrorOutput.from(error)), record);
    }

    private ExecutionError describe(PolyglotException e) {
        if (e.isSyntaxError()) {
            String location = e.getSourceLocation() != null
                    ? e.getSourceLocation().getSource().getName() + ":" + e.getSourceLocation().getStartLine()
                    : null;
            return new ExecutionError("SyntaxError", e.getMessage(), location);
        }
        if (e.isHostException()) {
            Throwable host = e.asHostException();
            return new ExecutionError(host.getClass().getSimpleName(), host.getMessage(), null);
        }
        Value guest = e.getGuestObject();
        if (guest != null && !guest.isNull()) {
            return describeGuestValue(guest);
        }
        return new ExecutionError("Error", e.getMessage(), null);
    }

    private ExecutionError describeGuestValue(Value error) {
        try {
            String json = internals.invokeMember("describeError", error).asString();
            return objectMapper.readValue(json, ExecutionError.class);
        } catch (JsonProcessingException | PolyglotException e) {
            log.debug("无法解析用户代码抛出的错误: {}", e.getMessage());
            return ExecutionError.of("Error", String.valueOf(error));
        }
    }

    // --- 上下文生命周期 ---

    private void ensureContext(String notebook) throws IOException {
        if (context != null && notebook.equals(notebookId)) {
            return;
        }
        closeContext();
        sandbox = environment.sandboxFor(notebook);
        var paths = new SandboxPaths(sandbox);
        eventLoop = new EventLoop();
        bridge = new KernelBridge(eventLoop, paths, objectMapper);
        context = Context.newBuilder("js")
                .allowHostAccess(HostAccess.EXPLICIT)
                .allowHostClassLookup(className -> false)
                .allowNativeAccess(false)
                .allowCreateThread(false)
                .allowCreateProcess(false)
                .allowIO(true)
                .fileSystem(new SandboxFileSystem(paths))
                .allowExperimentalOptions(true)
                .option("engine.WarnInterpreterOnly", "false")
                .option("js.commonjs-require", "true")
                .option("js.commonjs-require-cwd", sandbox.toString())
                .out(out)
                .err(err)
                .build();
        Value factory = context.eval(Source.newBuilder("js", prelude(), "kernel-prelude.js").buildLiteral());
        internals = factory.execute(bridge);
        notebookId = notebook;
        log.info("已为笔记本 {} 创建执行上下文，沙箱目录: {}", notebook, sandbox);
    }

    private void closeContext() {
        if (context == null) {
            return;
        }
        log.info("关闭笔记本 {} 的执行上下文", notebookId);
        try {
            context.close(true);
        } catch (PolyglotException e) {
            log.warn("关闭执行上下文时出错: {}", e.getMessage());
        }
        context = null;
        internals = null;
        notebookId = null;
    }

    private static void interruptUntilFinished(Context target, CancellationToken token) {
        while (!token.isFinished()) {
            try {
                target.interrupt(Duration.ofMillis(INTERRUPT_SLICE_MS));
                return;
            } catch (TimeoutException e) {
                // 执行线程正在宿主代码中，稍后重试
            } catch (IllegalStateException | PolyglotException e) {
                log.debug("中断执行上下文失败: {}", e.getMessage());
                return;
            }
        }
    }

    private static void joinInterrupter(Thread thread) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(INTERRUPTER_JOIN_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String prelude() throws IOException {
        try (InputStream in = NotebookRuntime.class.getResourceAsStream(PRELUDE_RESOURCE)) {
            if (in == null) {
                throw new IOException("缺少资源 " + PRELUDE_RESOURCE);
            }
            return IOUtils.toString(in, StandardCharsets.UTF_8);
        }
    }

    /** 当前上下文所属的笔记本，尚未执行任何作业时为 null。 */
    public String currentNotebookId() {
        return notebookId;
    }

    @Override
    public void close() {
        closeContext();
    }

    /** 单元格返回的 Promise 被拒绝。 */
    private static final class GuestRejectionException extends RuntimeException {

        private final transient ExecutionError error;

        GuestRejectionException(ExecutionError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }
}
