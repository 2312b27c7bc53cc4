/**
 * InvokeHandlerRequest.java
 *
 * 调用交互处理函数的请求体（例如前端组件上的点击事件）。
 */
package club.ppmc.kernel.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

public record InvokeHandlerRequest(
        @NotBlank String notebookId,
        @NotBlank String handlerId,
        @NotBlank String event,
        JsonNode payload,
        String componentId,
        String cellId,
        NotebookEnv env,
        Map<String, Object> globals,
        Long timeoutMs) {}
