package io.interviews.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.interviews.core.execution.history.History;
import io.interviews.core.execution.history.HistoryEntry;
import java.io.IOException;
import java.io.Serial;

/// Writes a `History` as the array of its entries, in order.
///
/// @see HistoryDeserializer for the inverse operation
class HistorySerializer extends StdSerializer<History> {

    @Serial private static final long serialVersionUID = 4462068143560791123L;

    HistorySerializer() {
        super(History.class);
    }

    @Override
    public void serialize(History history, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartArray();
        for (HistoryEntry entry : history.entries()) {
            provider.findValueSerializer(HistoryEntry.class).serialize(entry, gen, provider);
        }
        gen.writeEndArray();
    }
}
