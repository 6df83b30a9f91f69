package io.interviews.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.interviews.core.execution.history.History;
import io.interviews.core.execution.history.HistoryEntry;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Reads a `History` from the array of its entries.
///
/// @see HistorySerializer for the inverse operation
class HistoryDeserializer extends StdDeserializer<History> {

    @Serial private static final long serialVersionUID = -7330956110238710952L;

    HistoryDeserializer() {
        super(History.class);
    }

    @Override
    public History deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        JsonNode root = ctx.readTree(p);
        if (!root.isArray()) {
            throw new IOException("History must be an array of entries");
        }
        List<HistoryEntry> entries = new ArrayList<>(root.size());
        for (JsonNode entry : root) {
            entries.add(ctx.readTreeAsValue(entry, HistoryEntry.class));
        }
        return new History(entries);
    }
}
