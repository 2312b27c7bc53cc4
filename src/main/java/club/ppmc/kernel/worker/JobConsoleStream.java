/**
 * JobConsoleStream.java
 *
 * 安装为 GraalJS 上下文 out/err 的输出流。上下文在多个作业之间复用，
 * 所以这里只是一个转发点，每个作业开始时指向该作业的 ConsoleBuffer，结束后断开。
 */
package club.ppmc.kernel.worker;

import club.ppmc.kernel.protocol.FrameKind;
import java.io.OutputStream;

final class JobConsoleStream extends OutputStream {

    private final FrameKind kind;
    private volatile ConsoleBuffer target;

    JobConsoleStream(FrameKind kind) {
        this.kind = kind;
    }

    void attach(ConsoleBuffer buffer) {
        this.target = buffer;
    }

    void detach() {
        this.target = null;
    }

    @Override
    public void write(int b) {
        write(new byte[] {(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] bytes, int offset, int length) {
        ConsoleBuffer buffer = target;
        if (buffer != null) {
            buffer.write(kind, bytes, offset, length);
        }
    }
}
