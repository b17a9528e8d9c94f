package com.eyelevel.codeconverter.common.json.jackson;

import com.eyelevel.codeconverter.common.json.JsonParser;
import com.eyelevel.codeconverter.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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
        if (json == null) {
            throw new JsonParsingException("Cannot parse a null JSON string into " + valueType.getSimpleName(), null);
        }
        log.debug("Parsing JSON string to object of type: {}", valueType.getName());
        return parseJson(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        if (jsonBytes == null || jsonBytes.length == 0) {
            throw new JsonParsingException("Cannot parse an empty payload into " + valueType.getSimpleName(), null);
        }
        log.debug("Parsing JSON byte array ({} bytes) to object of type: {}", jsonBytes.length, valueType.getName());
        return parseJson(jsonBytes, valueType);
    }

    private <T> T parseJson(byte[] jsonBytes, Class<T> valueType) {
        try {
            T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON with Class: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON into " + valueType.getSimpleName(), e);
        }
    }
}
