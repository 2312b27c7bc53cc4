/**
 * CellRef.java
 *
 * 对笔记本单元格的最小引用：单元格ID与源码语言。
 * 工作进程据此选择转译器，并以单元格ID命名沙箱中的脚本源。
 */
package club.ppmc.kernel.model;

import jakarta.validation.constraints.NotBlank;

/**
 * @param id 单元格ID。
 * @param language 源码语言，"js" 或 "ts"。
 */
public record CellRef(@NotBlank String id, @NotBlank String language) {

    public static CellRef javascript(String id) {
        return new CellRef(id, "js");
    }
}
