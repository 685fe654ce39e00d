package com.nevis.digest.service.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.digest.exception.TaskPayloadException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON mapping of task inputs and outputs at the persistence boundary.
 */
@Component
@RequiredArgsConstructor
public class TaskPayloadCodec {

    private final ObjectMapper objectMapper;

    public String encode(TaskPayload payload) {
        return write(payload);
    }

    public <P extends TaskPayload> P decode(String json, Class<P> payloadType) {
        try {
            return objectMapper.readValue(json, payloadType);
        } catch (JsonProcessingException e) {
            throw new TaskPayloadException("Cannot decode " + payloadType.getSimpleName() + " payload", e);
        }
    }

    public String encodeResult(Object result) {
        return result == null ? null : write(result);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TaskPayloadException("Cannot encode " + value.getClass().getSimpleName(), e);
        }
    }
}
