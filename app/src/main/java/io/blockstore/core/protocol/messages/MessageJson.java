package io.blockstore.core.protocol.messages;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import io.blockstore.core.protocol.BlockStoreException;
import io.blockstore.core.protocol.ErrorCode;

import java.io.IOException;

/**
 * Shared JSON settings for wire messages: snake_case field names, digests as
 * hex multihash strings, blobs as base64.
 */
public final class MessageJson {
    private MessageJson() {}

    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    /** Unknown or missing "type" maps to UNKNOWN_REQUEST, anything else to INVALID_REQUEST. */
    public static BlockStoreException decodeFailure(IOException e) {
        if (e instanceof InvalidTypeIdException typeError) {
            return new BlockStoreException(ErrorCode.UNKNOWN_REQUEST,
                    "Unknown or missing type" + (typeError.getTypeId() == null ? "" : ": " + typeError.getTypeId()), e);
        }
        String detail = e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
        return new BlockStoreException(ErrorCode.INVALID_REQUEST, "Malformed message: " + detail, e);
    }
}
