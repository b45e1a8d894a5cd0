package org.opensearch.snapshotmanager.common;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class ObjectMapperFactory {

    /**
     * Returns a mapper that tolerates the extra fields Elasticsearch adds to its responses.
     */
    public static ObjectMapper createDefaultMapper() {
        return JsonMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();
    }

    private ObjectMapperFactory() {
        // Prevent instantiation
    }
}
