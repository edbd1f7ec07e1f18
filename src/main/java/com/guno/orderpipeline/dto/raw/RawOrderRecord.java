package com.guno.orderpipeline.dto.raw;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw order as read from the input, before normalization.
 * payload is null when the source line could not be parsed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawOrderRecord {

    private long position;
    private String source;
    private JsonNode payload;
    private String parseError;

    public boolean isMalformed() {
        return payload == null || !payload.isObject();
    }

    public String getOrderIdHint() {
        if (payload == null || !payload.hasNonNull("order_id")) {
            return "UNKNOWN";
        }
        return payload.get("order_id").asText();
    }
}
