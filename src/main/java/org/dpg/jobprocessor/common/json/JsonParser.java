package org.dpg.jobprocessor.common.json;

import org.dpg.jobprocessor.exception.json.JsonParsingException;

/**
 * Parses JSON bodies of external services and the output of command-line tools.
 */
public interface JsonParser {

    /**
     * @throws JsonParsingException if the JSON is malformed or does not fit the type.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * @throws JsonParsingException if the JSON is malformed or does not fit the type.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);
}
