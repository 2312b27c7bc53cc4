/**
 * IpcMessage.java
 *
 * 编排器与工作进程之间的结构化消息，以 JSON 形式承载在 CONTROL 帧中。
 * 以 "type" 字段区分：RunCell、InvokeHandler、Cancel 由编排器发出；Ack、Result、Error 由工作进程发出。
 */
package club.ppmc.kernel.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RunCellMessage.class, name = "RunCell"),
    @JsonSubTypes.Type(value = InvokeHandlerMessage.class, name = "InvokeHandler"),
    @JsonSubTypes.Type(value = CancelMessage.class, name = "Cancel"),
    @JsonSubTypes.Type(value = AckMessage.class, name = "Ack"),
    @JsonSubTypes.Type(value = ResultMessage.class, name = "Result"),
    @JsonSubTypes.Type(value = ErrorMessage.class, name = "Error")
})
public interface IpcMessage {

    /** 单个作业执行的 ID，整个生命周期内不变。 */
    String jobId();
}
