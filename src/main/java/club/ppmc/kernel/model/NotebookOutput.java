/**
 * NotebookOutput.java
 *
 * 单元格输出的公共接口，形状与 Jupyter 的输出格式保持一致。
 * 以 "type" 字段区分具体类型：stream / display_data / update_display_data / execute_result / error。
 */
package club.ppmc.kernel.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "type",
        visible = true)
@JsonSubTypes({
    @JsonSubTypes.Type(value = StreamOutput.class, name = "stream"),
    @JsonSubTypes.Type(
            value = DisplayDataOutput.class,
            names = {"display_data", "update_display_data", "execute_result"}),
    @JsonSubTypes.Type(value = ErrorOutput.class, name = "error")
})
public interface NotebookOutput {

    String type();
}
