/**
 * SandboxPaths.java
 *
 * 笔记本沙箱目录的路径约束。用户代码给出的相对路径以沙箱目录为基准解析，
 * 解析结果（包括符号链接的真实位置）必须仍在沙箱目录之内。
 */
package club.ppmc.kernel.worker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class SandboxPaths {

    private final Path root;
    private final Path realRoot;

    public SandboxPaths(Path root) {
        this.root = root.toAbsolutePath().normalize();
        Path real;
        try {
            real = Files.exists(this.root) ? this.root.toRealPath() : this.root;
        } catch (IOException e) {
            real = this.root;
        }
        this.realRoot = real;
    }

    public Path root() {
        return root;
    }

    /**
     * 把用户给出的路径解析为沙箱内的绝对路径。
     *
     * @throws SecurityException 路径指向沙箱之外。
     */
    public Path resolve(String input) {
        Path resolved = root.resolve(input).normalize();
        if (!isWithin(resolved)) {
            throw new SecurityException(deniedMessage(input));
        }
        return resolved;
    }

    /** 已经是绝对路径时的检查版本。 */
    public Path check(Path path) {
        Path absolute = (path.isAbsolute() ? path : root.resolve(path)).normalize();
        if (!isWithin(absolute)) {
            throw new SecurityException(deniedMessage(path.toString()));
        }
        return absolute;
    }

    public boolean isWithin(Path absolute) {
        Path normalized = absolute.toAbsolutePath().normalize();
        if (!normalized.startsWith(root)) {
            return false;
        }
        Path existing = normalized;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return true;
        }
        try {
            return existing.toRealPath().startsWith(realRoot);
        } catch (IOException e) {
            return false;
        }
    }

    public static String deniedMessage(String input) {
        return "Access to path \"" + input + "\" is not allowed in this notebook runtime";
    }
}
