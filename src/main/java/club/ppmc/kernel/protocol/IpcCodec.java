/**
 * IpcCodec.java
 *
 * 结构化消息的 JSON 编解码器。解码时先做多态反序列化，再用 Jakarta Bean Validation 校验，
 * 任何一步失败都只记录 debug 日志并返回空结果，调用方据此静默丢弃该消息。
 */
package club.ppmc.kernel.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class IpcCodec {

    private static final ValidatorFactory VALIDATOR_FACTORY = Validation.buildDefaultValidatorFactory();

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public IpcCodec() {
        this(createObjectMapper());
    }

    public IpcCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.validator = VALIDATOR_FACTORY.getValidator();
    }

    /** 协议两端共用的 ObjectMapper 配置：忽略未知字段，省略 null 字段。 */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public byte[] encode(IpcMessage message) {
        try {
            return objectMapper.writerFor(IpcMessage.class).writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("无法序列化IPC消息: " + message.getClass().getSimpleName(), e);
        }
    }

    public Optional<IpcMessage> decode(byte[] json) {
        IpcMessage message;
        try {
            message = objectMapper.readValue(json, IpcMessage.class);
        } catch (IOException e) {
            log.debug("丢弃无法解析的IPC消息: {}", e.getMessage());
            return Optional.empty();
        }
        if (message == null) {
            return Optional.empty();
        }
        Set<ConstraintViolation<IpcMessage>> violations = validator.validate(message);
        if (!violations.isEmpty()) {
            log.debug("丢弃未通过校验的IPC消息 {}: {}", message.getClass().getSimpleName(), violations);
            return Optional.empty();
        }
        return Optional.of(message);
    }
}
