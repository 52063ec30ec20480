// file: storage/src/main/java/io/envsync/storage/RecordCodec.java
package io.envsync.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.envsync.core.ResourceRecord;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding of a single {@link ResourceRecord}.
 * <p>
 * Format: one pretty-printed JSON object per record, fields in record order,
 * UTF-8. Anything that is not a JSON object is rejected on decode.
 */
public final class RecordCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

    private RecordCodec() {
        // utility
    }

    public static byte[] encode(ResourceRecord record) {
        try {
            return MAPPER.writeValueAsBytes(record.fields());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("record is not serializable: " + record, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the bytes are not a JSON object
     */
    public static ResourceRecord decode(byte[] json) {
        try {
            Map<String, Object> fields = MAPPER.readValue(json, FIELDS);
            if (fields == null) {
                throw new IllegalArgumentException("expected a JSON object, got null");
            }
            return new ResourceRecord(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("expected a JSON object: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }
}
