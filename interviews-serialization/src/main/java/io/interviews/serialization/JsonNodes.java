package io.interviews.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Tree accessors shared by the deserializers.
final class JsonNodes {

    private JsonNodes() {}

    /// Returns a text field, empty when absent or null.
    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    /// Returns a text field that must be present.
    ///
    /// @throws IOException naming the field and the type being read
    static String requiredText(JsonNode node, String field, String type) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("Missing '" + field + "' in " + type);
        }
        return value.asText();
    }

    /// Returns an array of strings, empty when absent.
    static List<String> strings(JsonNode node, String field) {
        List<String> result = new ArrayList<>();
        JsonNode array = node.get(field);
        if (array != null) {
            for (JsonNode item : array) {
                result.add(item.asText());
            }
        }
        return result;
    }
}
