/**
 * InvokeHandlerMessage.java
 *
 * 请求工作进程调用笔记本中通过 registerHandler 注册的交互处理函数。
 */
package club.ppmc.kernel.protocol;

import club.ppmc.kernel.model.NotebookEnv;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.Map;

public record InvokeHandlerMessage(
        @NotBlank String jobId,
        @NotBlank String handlerId,
        @NotBlank String notebookId,
        @NotNull @Valid NotebookEnv env,
        @NotBlank String event,
        JsonNode payload,
        String componentId,
        String cellId,
        @Positive @Max(IpcLimits.MAX_TIMEOUT_MS) Long timeoutMs,
        Map<String, Object> globals)
        implements IpcMessage {}
