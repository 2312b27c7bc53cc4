/**
 * IpcCodecTest.java
 *
 * 结构化消息的序列化、多态解析与校验。
 */
package club.ppmc.kernel.protocol;

import club.ppmc.kernel.model.CellRef;
import club.ppmc.kernel.model.DisplayDataOutput;
import club.ppmc.kernel.model.ErrorOutput;
import club.ppmc.kernel.model.ExecutionRecord;
import club.ppmc.kernel.model.ExecutionStatus;
import club.ppmc.kernel.model.NotebookEnv;
import club.ppmc.kernel.model.StreamOutput;
import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IpcCodecTest {

    private final IpcCodec codec = new IpcCodec();

    private Optional<IpcMessage> decode(String json) {
        return codec.decode(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void runCellIsTaggedWithItsType() throws Exception {
        var message = new RunCellMessage(
                "s:c1:1", CellRef.javascript("c1"), "1 + 1", "nb", NotebookEnv.empty(), 5000L, null);

        JsonNode json = codec.objectMapper().readTree(codec.encode(message));

        assertEquals("RunCell", json.get("type").asText());
        assertEquals("s:c1:1", json.get("jobId").asText());
        assertEquals("js", json.at("/cell/language").asText());
        assertFalse(json.has("globals"), "null fields are omitted");
    }

    @Test
    void decodesEachMessageType() {
        assertInstanceOf(CancelMessage.class, decode("{\"type\":\"Cancel\",\"jobId\":\"j\"}").orElseThrow());
        assertInstanceOf(AckMessage.class, decode("{\"type\":\"Ack\",\"jobId\":\"j\"}").orElseThrow());
        ErrorMessage error = (ErrorMessage) decode("{\"type\":\"Error\",\"jobId\":\"j\",\"message\":\"boom\"}").orElseThrow();
        assertEquals("boom", error.message());
        assertNull(error.name());
    }

    @Test
    void resultKeepsConcreteOutputTypes() {
        var result = new ResultMessage("j", List.of(
                StreamOutput.stdout("x"),
                new DisplayDataOutput("execute_result", Map.of("text/plain", "2"), Map.of()),
                new ErrorOutput("error", "TypeError", "bad", List.of("at <cell>"))),
                new ExecutionRecord(1, 2, ExecutionStatus.ERROR, null));

        ResultMessage decoded = (ResultMessage) codec.decode(codec.encode(result)).orElseThrow();

        assertEquals(ExecutionStatus.ERROR, decoded.execution().status());
        assertInstanceOf(StreamOutput.class, decoded.outputs().get(0));
        DisplayDataOutput display = (DisplayDataOutput) decoded.outputs().get(1);
        assertEquals("execute_result", display.type());
        assertEquals("2", display.data().get("text/plain"));
        assertEquals("TypeError", ((ErrorOutput) decoded.outputs().get(2)).ename());
    }

    @Test
    void statusIsSerializedLowercase() throws Exception {
        var result = new ResultMessage("j", List.of(), ExecutionRecord.ok(1, 2));

        JsonNode json = codec.objectMapper().readTree(codec.encode(result));

        assertEquals("ok", json.at("/execution/status").asText());
    }

    @Test
    void dropsUnknownOrMalformedMessages() {
        assertTrue(decode("{\"type\":\"Shutdown\",\"jobId\":\"j\"}").isEmpty());
        assertTrue(decode("{\"jobId\":\"j\"}").isEmpty());
        assertTrue(decode("not json").isEmpty());
        assertTrue(decode("").isEmpty());
    }

    @Test
    void dropsMessagesThatFailValidation() {
        assertTrue(decode("{\"type\":\"Cancel\",\"jobId\":\"\"}").isEmpty());
        assertTrue(decode("{\"type\":\"RunCell\",\"jobId\":\"j\",\"cell\":{\"id\":\"c\",\"language\":\"js\"},"
                + "\"code\":\"1\",\"notebookId\":\"nb\",\"env\":{},\"timeoutMs\":0}").isEmpty());
        assertTrue(decode("{\"type\":\"RunCell\",\"jobId\":\"j\",\"cell\":{\"id\":\"c\",\"language\":\"js\"},"
                + "\"code\":\"1\",\"notebookId\":\"nb\",\"env\":{},\"timeoutMs\":600001}").isEmpty());
        assertTrue(decode("{\"type\":\"RunCell\",\"jobId\":\"j\",\"code\":\"1\",\"notebookId\":\"nb\",\"env\":{}}").isEmpty());
    }

    @Test
    void acceptsRunCellWithinLimits() {
        RunCellMessage message = (RunCellMessage) decode("{\"type\":\"RunCell\",\"jobId\":\"j\",\"cell\":{\"id\":\"c\",\"language\":\"ts\"},"
                + "\"code\":\"1\",\"notebookId\":\"nb\",\"env\":{\"packages\":{\"lodash\":\"^4\"}},\"timeoutMs\":600000,"
                + "\"extra\":true}").orElseThrow();

        assertEquals("ts", message.cell().language());
        assertEquals("graaljs", message.env().runtime());
        assertEquals(Map.of("lodash", "^4"), message.env().packages());
    }
}
