/**
 * RunCellMessage.java
 *
 * 请求工作进程执行一个单元格。
 */
package club.ppmc.kernel.protocol;

import club.ppmc.kernel.model.CellRef;
import club.ppmc.kernel.model.NotebookEnv;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.Map;

public record RunCellMessage(
        @NotBlank String jobId,
        @NotNull @Valid CellRef cell,
        @NotNull String code,
        @NotBlank String notebookId,
        @NotNull @Valid NotebookEnv env,
        @Positive @Max(IpcLimits.MAX_TIMEOUT_MS) Long timeoutMs,
        Map<String, Object> globals)
        implements IpcMessage {}
