/**
 * JobOptions.java
 *
 * 提交给工作池的一个作业的完整描述，以及接收流式输出的三个回调。
 * 回调在工作进程的读取线程上按输出顺序调用，实现方不应阻塞。
 */
package club.ppmc.kernel.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.function.Consumer;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class JobOptions {

    @Builder.Default JobKind kind = JobKind.EXECUTE;

    // --- 单元格执行 ---
    CellRef cell;
    String code;

    // --- 交互处理函数调用 ---
    String handlerId;
    String event;
    JsonNode payload;
    String componentId;
    String cellId;

    String notebookId;
    @Builder.Default NotebookEnv env = NotebookEnv.empty();
    Map<String, Object> globals;

    /** 为 null 时使用工作池当前的默认超时。 */
    Long timeoutMs;

    @Builder.Default Consumer<String> onStdout = text -> {};
    @Builder.Default Consumer<String> onStderr = text -> {};
    @Builder.Default Consumer<JsonNode> onDisplay = display -> {};
}
