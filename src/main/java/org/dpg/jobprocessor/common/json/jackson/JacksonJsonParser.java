package org.dpg.jobprocessor.common.json.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.json.JsonParser;
import org.dpg.jobprocessor.exception.json.JsonParsingException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link JsonParser} backed by the application's Jackson {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        log.debug("Parsing JSON string to object of type: {}", valueType.getName());
        return parseJson(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        log.debug("Parsing JSON byte array to object of type: {}", valueType.getName());
        return parseJson(jsonBytes, valueType);
    }

    private <T> T parseJson(byte[] jsonBytes, Class<T> valueType) {
        try {
            T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON with Class: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON as " + valueType.getSimpleName(), e);
        }
    }
}
