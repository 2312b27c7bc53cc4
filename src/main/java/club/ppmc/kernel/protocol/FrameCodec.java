/**
 * FrameCodec.java
 *
 * 帧的编解码工具。帧格式为 [kind:1字节][length:无符号LEB128变长整数][payload]，
 * 长度前缀最多5个字节。解码方法对截断或畸形输入返回 null，从不抛出异常。
 */
package club.ppmc.kernel.protocol;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

public final class FrameCodec {

    public static final int MAX_VARINT_BYTES = 5;

    private FrameCodec() {}

    public static byte[] encode(FrameKind kind, byte[] payload) {
        int length = payload.length;
        byte[] out = new byte[1 + varintSize(length) + length];
        out[0] = (byte) kind.code();
        int pos = 1;
        int value = length;
        while ((value & ~0x7F) != 0) {
            out[pos++] = (byte) ((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out[pos++] = (byte) value;
        System.arraycopy(payload, 0, out, pos, length);
        return out;
    }

    public static byte[] encodeText(FrameKind kind, String text) {
        return encode(kind, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 尝试从字节数组开头解码一个完整的帧。
     *
     * @return 解码出的帧；输入为空、被截断、长度前缀畸形或类型未知时返回 null。
     */
    public static Frame tryDecode(byte[] bytes) {
        if (bytes == null || bytes.length < 2) {
            return null;
        }
        FrameKind kind = FrameKind.fromCode(bytes[0] & 0xFF);
        if (kind == null) {
            return null;
        }
        long length = 0;
        int shift = 0;
        int pos = 1;
        while (true) {
            if (pos >= bytes.length || pos > MAX_VARINT_BYTES) {
                return null;
            }
            int b = bytes[pos++] & 0xFF;
            length |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                break;
            }
            shift += 7;
        }
        if (length > Integer.MAX_VALUE || pos + length > bytes.length) {
            return null;
        }
        byte[] payload = new byte[(int) length];
        System.arraycopy(bytes, pos, payload, 0, (int) length);
        return new Frame(kind, payload);
    }

    static int varintSize(int value) {
        int size = 1;
        int v = value;
        while ((v & ~0x7F) != 0) {
            size++;
            v >>>= 7;
        }
        return size;
    }

    /**
     * 从流中读取一个长度前缀。
     *
     * @return 长度；流在第一个字节之前结束时返回 -1。
     */
    static long readVarint(InputStream in, boolean firstByteMayBeEof) throws IOException {
        long value = 0;
        int shift = 0;
        for (int i = 0; i < MAX_VARINT_BYTES; i++) {
            int b = in.read();
            if (b < 0) {
                if (i == 0 && firstByteMayBeEof) {
                    return -1;
                }
                throw new EOFException("帧长度前缀被截断");
            }
            value |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
            shift += 7;
        }
        throw new FrameProtocolException("帧长度前缀超过 " + MAX_VARINT_BYTES + " 个字节");
    }

    static void writeTo(OutputStream out, FrameKind kind, byte[] payload) throws IOException {
        out.write(encode(kind, payload));
    }
}
