/**
 * BytePipe.java
 *
 * 测试用的内存管道：一端写、一端读，写端关闭后读端读到 EOF。
 * 与 PipedInputStream 不同，它不关心写线程是否还存活。
 */
package club.ppmc.kernel.pool;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

final class BytePipe {

    private static final byte[] EOF = new byte[0];

    private final BlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
    private volatile boolean closed;

    private final OutputStream out = new OutputStream() {
        @Override
        public void write(int b) throws IOException {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            synchronized (BytePipe.this) {
                if (closed) {
                    throw new IOException("Pipe closed");
                }
                if (len > 0) {
                    chunks.add(Arrays.copyOfRange(b, off, off + len));
                }
            }
        }

        @Override
        public void close() {
            BytePipe.this.close();
        }
    };

    private final InputStream in = new InputStream() {
        private byte[] current;
        private int position;

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n < 0 ? -1 : one[0] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (len == 0) {
                return 0;
            }
            if (current == null || position >= current.length) {
                try {
                    current = chunks.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("Interrupted while reading pipe");
                }
                position = 0;
                if (current == EOF) {
                    chunks.add(EOF);
                    return -1;
                }
            }
            int n = Math.min(len, current.length - position);
            System.arraycopy(current, position, b, off, n);
            position += n;
            return n;
        }

        @Override
        public int available() {
            return current == null || current == EOF ? 0 : current.length - position;
        }
    };

    OutputStream out() {
        return out;
    }

    InputStream in() {
        return in;
    }

    synchronized void close() {
        if (!closed) {
            closed = true;
            chunks.add(EOF);
        }
    }
}
