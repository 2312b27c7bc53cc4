/**
 * ErrorMessage.java
 *
 * 工作进程自身（而非用户代码）的失败，例如收到作业时仍处于忙碌状态。
 */
package club.ppmc.kernel.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.io.PrintWriter;
import java.io.StringWriter;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorMessage(@NotBlank String jobId, String name, @NotNull String message, String stack)
        implements IpcMessage {

    public static ErrorMessage of(String jobId, Throwable error) {
        var trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        String message = error.getMessage() == null ? error.toString() : error.getMessage();
        return new ErrorMessage(jobId, error.getClass().getSimpleName(), message, trace.toString());
    }
}
