/**
 * FrameWriter.java
 *
 * 向输出流写帧。每帧作为一次整体写入并立即 flush，多线程写入时帧之间不会交错。
 */
package club.ppmc.kernel.protocol;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

public class FrameWriter {

    private final OutputStream out;

    public FrameWriter(OutputStream out) {
        this.out = out;
    }

    public synchronized void write(FrameKind kind, byte[] payload) throws IOException {
        FrameCodec.writeTo(out, kind, payload);
        out.flush();
    }

    public void writeText(FrameKind kind, String text) throws IOException {
        write(kind, text.getBytes(StandardCharsets.UTF_8));
    }

    public synchronized void close() throws IOException {
        out.close();
    }
}
