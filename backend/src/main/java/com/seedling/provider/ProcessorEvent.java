package com.seedling.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Authenticated webhook envelope. {@code object} is the {@code data.object} payload of the event.
 */
public record ProcessorEvent(
        String id,
        String type,
        JsonNode object
) {

    public String objectId() {
        return textField("id");
    }

    public String textField(String field) {
        if (object == null) {
            return null;
        }
        JsonNode value = object.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
