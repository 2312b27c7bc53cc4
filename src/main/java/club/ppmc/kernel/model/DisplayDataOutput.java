/**
 * DisplayDataOutput.java
 *
 * 富展示输出。data 以 MIME 类型为键（如 "text/plain"、"application/json"、"text/html"），
 * metadata 中可能携带 display_id 与 streamed 标记。
 */
package club.ppmc.kernel.model;

import java.util.Map;
import java.util.Set;

public record DisplayDataOutput(String type, Map<String, Object> data, Map<String, Object> metadata)
        implements NotebookOutput {

    /** 允许转发给调用方的展示类型。 */
    public static final Set<String> DISPLAY_TYPES =
            Set.of("display_data", "update_display_data", "execute_result");

    public DisplayDataOutput {
        type = type == null ? "display_data" : type;
        data = data == null ? Map.of() : data;
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static DisplayDataOutput plainText(String text) {
        return new DisplayDataOutput("display_data", Map.of("text/plain", text), Map.of());
    }
}
