/**
 * SandboxFileSystem.java
 *
 * 提供给 GraalJS 上下文的文件系统（CommonJS require 通过它加载模块）。
 * 所有操作委托给默认文件系统，但只允许访问沙箱目录：
 * 探测类操作（存在性、属性）对沙箱外的路径表现为文件不存在，读写与删除则直接拒绝。
 */
package club.ppmc.kernel.worker;

import java.io.IOException;
import java.net.URI;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.AccessMode;
import java.nio.file.DirectoryStream;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.attribute.FileAttribute;
import java.util.Map;
import java.util.Set;
import org.graalvm.polyglot.io.FileSystem;

public class SandboxFileSystem implements FileSystem {

    private final SandboxPaths paths;
    private final FileSystem delegate = FileSystem.newDefaultFileSystem();

    public SandboxFileSystem(SandboxPaths paths) {
        this.paths = paths;
    }

    @Override
    public Path parsePath(URI uri) {
        return delegate.parsePath(uri);
    }

    @Override
    public Path parsePath(String path) {
        return delegate.parsePath(path);
    }

    @Override
    public void checkAccess(Path path, Set<? extends AccessMode> modes, LinkOption... linkOptions)
            throws IOException {
        delegate.checkAccess(confine(path), modes, linkOptions);
    }

    @Override
    public void createDirectory(Path dir, FileAttribute<?>... attrs) throws IOException {
        delegate.createDirectory(paths.check(dir), attrs);
    }

    @Override
    public void delete(Path path) throws IOException {
        delegate.delete(paths.check(path));
    }

    @Override
    public SeekableByteChannel newByteChannel(
            Path path, Set<? extends OpenOption> options, FileAttribute<?>... attrs) throws IOException {
        return delegate.newByteChannel(paths.check(path), options, attrs);
    }

    @Override
    public DirectoryStream<Path> newDirectoryStream(Path dir, DirectoryStream.Filter<? super Path> filter)
            throws IOException {
        return delegate.newDirectoryStream(paths.check(dir), filter);
    }

    @Override
    public Path toAbsolutePath(Path path) {
        return path.isAbsolute() ? path : paths.root().resolve(path);
    }

    @Override
    public Path toRealPath(Path path, LinkOption... linkOptions) throws IOException {
        return delegate.toRealPath(confine(path), linkOptions);
    }

    @Override
    public Map<String, Object> readAttributes(Path path, String attributes, LinkOption... options)
            throws IOException {
        return delegate.readAttributes(confine(path), attributes, options);
    }

    private Path confine(Path path) throws NoSuchFileException {
        Path absolute = toAbsolutePath(path).normalize();
        if (!paths.isWithin(absolute)) {
            throw new NoSuchFileException(path.toString());
        }
        return absolute;
    }
}
