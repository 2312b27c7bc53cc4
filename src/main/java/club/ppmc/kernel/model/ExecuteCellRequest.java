/**
 * ExecuteCellRequest.java
 *
 * 执行单元格的请求体，既用于 STOMP 消息也用于会话客户端。
 */
package club.ppmc.kernel.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;

public record ExecuteCellRequest(
        @NotBlank String notebookId,
        @NotNull @Valid CellRef cell,
        @NotNull String code,
        NotebookEnv env,
        Map<String, Object> globals,
        Long timeoutMs) {}
