package berth.coordinator.store;

import berth.coordinator.model.ResourceSlot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON encoding of resource slots stored in CLOB columns.
 */
final class SlotColumns {

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    private SlotColumns() {
    }

    static String write(ResourceSlot slot) {
        try {
            return MAPPER.writeValueAsString(slot != null ? slot : ResourceSlot.empty());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode resource slot: " + slot, e);
        }
    }

    static ResourceSlot read(String json) {
        if (json == null || json.isBlank()) {
            return ResourceSlot.empty();
        }
        try {
            return MAPPER.readValue(json, ResourceSlot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to decode resource slot: " + json, e);
        }
    }
}
