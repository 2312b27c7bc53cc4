/**
 * CancelMessage.java
 *
 * 请求工作进程协作式地停止某个作业。
 */
package club.ppmc.kernel.protocol;

import jakarta.validation.constraints.NotBlank;

public record CancelMessage(@NotBlank String jobId) implements IpcMessage {}
