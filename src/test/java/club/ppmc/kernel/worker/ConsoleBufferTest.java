/**
 * ConsoleBufferTest.java
 */
package club.ppmc.kernel.worker;

import club.ppmc.kernel.protocol.FrameKind;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleBufferTest {

    private record Sent(FrameKind kind, String text) {}

    private final List<Sent> sent = new ArrayList<>();
    private final List<byte[]> raw = new ArrayList<>();
    private final ConsoleBuffer buffer = new ConsoleBuffer((kind, payload) -> {
        sent.add(new Sent(kind, new String(payload, StandardCharsets.UTF_8)));
        raw.add(payload);
    });

    @Test
    void batchesWritesOfTheSameStream() {
        buffer.write(FrameKind.STDOUT, "a");
        buffer.write(FrameKind.STDOUT, "b");
        assertTrue(sent.isEmpty());

        buffer.flush();

        assertEquals(List.of(new Sent(FrameKind.STDOUT, "ab")), sent);
    }

    @Test
    void switchingStreamsKeepsTheOrder() {
        buffer.write(FrameKind.STDOUT, "1");
        buffer.write(FrameKind.STDERR, "2");
        buffer.write(FrameKind.STDOUT, "3");
        buffer.flushAll();

        assertEquals(List.of(
                new Sent(FrameKind.STDOUT, "1"),
                new Sent(FrameKind.STDERR, "2"),
                new Sent(FrameKind.STDOUT, "3")), sent);
    }

    @Test
    void periodicFlushNeverSplitsACharacter() {
        byte[] euro = "€".getBytes(StandardCharsets.UTF_8);
        buffer.write(FrameKind.STDOUT, new byte[] {'x', euro[0], euro[1]}, 0, 3);

        buffer.flush();
        assertEquals(List.of(new Sent(FrameKind.STDOUT, "x")), sent);

        buffer.write(FrameKind.STDOUT, euro, 2, 1);
        buffer.flush();
        assertEquals(new Sent(FrameKind.STDOUT, "€"), sent.get(1));
    }

    @Test
    void displayFlushesPendingTextFirst() {
        buffer.write(FrameKind.STDOUT, "before");

        buffer.display("{\"type\":\"display_data\"}".getBytes(StandardCharsets.UTF_8));

        assertEquals(FrameKind.STDOUT, sent.get(0).kind());
        assertEquals(FrameKind.DISPLAY, sent.get(1).kind());
    }

    @Test
    void discardsEverythingAfterCancellation() {
        buffer.write(FrameKind.STDOUT, "kept");
        buffer.discardFurther();
        buffer.write(FrameKind.STDOUT, "dropped");
        buffer.display("{}".getBytes(StandardCharsets.UTF_8));
        buffer.flushAll();

        assertEquals(List.of(new Sent(FrameKind.STDOUT, "kept")), sent);
        assertTrue(buffer.isDiscarding());
    }

    @Test
    void largeOutputIsChunked() {
        String big = "é".repeat(ConsoleBuffer.MAX_CHUNK_BYTES);
        buffer.write(FrameKind.STDOUT, big);
        buffer.flushAll();

        assertTrue(raw.size() >= 2);
        raw.forEach(chunk -> assertTrue(chunk.length <= ConsoleBuffer.MAX_CHUNK_BYTES));
        StringBuilder joined = new StringBuilder();
        sent.forEach(s -> joined.append(s.text()));
        assertEquals(big, joined.toString());
    }

    @Test
    void bufferBeyondOneChunkIsSentWithoutWaitingForFlush() {
        String line = "x".repeat(1000) + "\n";
        int writes = 3 * ConsoleBuffer.MAX_CHUNK_BYTES / line.length();
        for (int i = 0; i < writes; i++) {
            buffer.write(FrameKind.STDOUT, line);
        }

        assertTrue(sent.size() >= 2, "frames sent before any flush: " + sent.size());
        int sentBytes = raw.stream().mapToInt(chunk -> chunk.length).sum();
        assertTrue(writes * line.length() - sentBytes <= ConsoleBuffer.MAX_CHUNK_BYTES);

        buffer.flushAll();
        assertEquals(writes * line.length(), raw.stream().mapToInt(chunk -> chunk.length).sum());
    }

    @Test
    void completeUtf8LengthStopsBeforeATruncatedSequence() {
        byte[] smile = "😀".getBytes(StandardCharsets.UTF_8);

        assertEquals(4, ConsoleBuffer.completeUtf8Length(smile));
        assertEquals(0, ConsoleBuffer.completeUtf8Length(Arrays.copyOf(smile, 3)));
        assertEquals(2, ConsoleBuffer.completeUtf8Length(new byte[] {'a', 'b'}));
        assertEquals(0, ConsoleBuffer.completeUtf8Length(new byte[0]));
    }
}
