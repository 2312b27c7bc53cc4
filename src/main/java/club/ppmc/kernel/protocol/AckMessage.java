/**
 * AckMessage.java
 *
 * 工作进程开始执行作业时发出的确认。
 */
package club.ppmc.kernel.protocol;

import jakarta.validation.constraints.NotBlank;

public record AckMessage(@NotBlank String jobId) implements IpcMessage {}
