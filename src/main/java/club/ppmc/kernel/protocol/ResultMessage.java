/**
 * ResultMessage.java
 *
 * 作业的最终结果。工作进程在刷新完该作业的所有缓冲输出之后才会发出它。
 */
package club.ppmc.kernel.protocol;

import club.ppmc.kernel.model.ExecutionRecord;
import club.ppmc.kernel.model.ExecutionResult;
import club.ppmc.kernel.model.NotebookOutput;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ResultMessage(
        @NotBlank String jobId, @NotNull List<NotebookOutput> outputs, @NotNull @Valid ExecutionRecord execution)
        implements IpcMessage {

    public static ResultMessage of(String jobId, ExecutionResult result) {
        return new ResultMessage(jobId, result.outputs(), result.execution());
    }

    public ExecutionResult toResult() {
        return new ExecutionResult(outputs, execution);
    }
}
