package io.interviews.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.interviews.core.execution.history.HistoryEntry;
import io.interviews.core.execution.history.HistoryEntry.AnswerEntry;
import io.interviews.core.execution.history.HistoryEntry.BeginLoopMark;
import io.interviews.core.execution.history.HistoryEntry.EndLoopMark;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `HistoryEntry` sealed hierarchy with a `"type"` discriminator field.
///
/// - **`AnswerEntry`**: `{"type":"answer","answer":{...}}`, the answer as its record form
/// - **`BeginLoopMark`**: `{"type":"begin_loop","label":"...","operandAnswerIndex":N,
///   "iterationIndex":N}`; a dangling operand reference is written as `-1`
/// - **`EndLoopMark`**: `{"type":"end_loop","label":"..."}`
///
/// @see HistoryEntryDeserializer for the inverse operation
class HistoryEntrySerializer extends StdSerializer<HistoryEntry> {

    @Serial private static final long serialVersionUID = 8235917735410386417L;

    HistoryEntrySerializer() {
        super(HistoryEntry.class);
    }

    @Override
    public void serialize(HistoryEntry entry, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (entry instanceof AnswerEntry a) {
            gen.writeStringField("type", "answer");
            gen.writeFieldName("answer");
            provider.defaultSerializeValue(a.answer(), gen);
        } else if (entry instanceof BeginLoopMark b) {
            gen.writeStringField("type", "begin_loop");
            gen.writeStringField("label", b.beginLoopLabel());
            gen.writeNumberField("operandAnswerIndex", b.operandAnswerIndex());
            gen.writeNumberField("iterationIndex", b.iterationIndex());
        } else if (entry instanceof EndLoopMark e) {
            gen.writeStringField("type", "end_loop");
            gen.writeStringField("label", e.endLoopLabel());
        }
        gen.writeEndObject();
    }
}
