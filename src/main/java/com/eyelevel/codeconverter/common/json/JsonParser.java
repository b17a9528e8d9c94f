package com.eyelevel.codeconverter.common.json;

/**
 * Parses JSON payloads returned by the remote APIs into Java types.
 *
 * <p>Implementations hide the JSON library in use from the API clients.
 */
public interface JsonParser {

    /**
     * Parses JSON text into an object of the given type.
     *
     * @param json      The JSON data as a string.
     * @param valueType The target class.
     * @param <T>       The target type.
     *
     * @return The parsed object.
     *
     * @throws com.eyelevel.codeconverter.exception.json.JsonParsingException if the payload is not valid for the type.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * Parses UTF-8 encoded JSON bytes into an object of the given type.
     *
     * @param jsonBytes The JSON data as a byte array.
     * @param valueType The target class.
     * @param <T>       The target type.
     *
     * @return The parsed object.
     *
     * @throws com.eyelevel.codeconverter.exception.json.JsonParsingException if the payload is empty or not valid for the type.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);
}
