package io.interviews.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.interviews.core.execution.history.HistoryEntry;
import io.interviews.core.interview.Answer;
import java.io.IOException;
import java.io.Serial;

/// Deserializes `HistoryEntry` variants based on the `type` discriminator field.
///
/// The nested answer delegates to the context, which reads the `Answer` record through
/// its canonical constructor and the registered `AnswerBody` deserializer.
///
/// @see HistoryEntrySerializer for the inverse operation
class HistoryEntryDeserializer extends StdDeserializer<HistoryEntry> {

    @Serial private static final long serialVersionUID = -1587452006378424733L;

    HistoryEntryDeserializer() {
        super(HistoryEntry.class);
    }

    @Override
    public HistoryEntry deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        JsonNode root = ctx.readTree(p);

        String type = JsonNodes.requiredText(root, "type", "HistoryEntry");

        return switch (type) {
            case "answer" -> {
                JsonNode answer = root.get("answer");
                if (answer == null || answer.isNull()) {
                    throw new IOException("Missing 'answer' in HistoryEntry");
                }
                yield new HistoryEntry.AnswerEntry(ctx.readTreeAsValue(answer, Answer.class));
            }
            case "begin_loop" ->
                    new HistoryEntry.BeginLoopMark(
                            JsonNodes.requiredText(root, "label", "begin_loop"),
                            root.path("operandAnswerIndex")
                                    .asInt(HistoryEntry.BeginLoopMark.DANGLING),
                            root.path("iterationIndex").asInt(0));
            case "end_loop" ->
                    new HistoryEntry.EndLoopMark(
                            JsonNodes.requiredText(root, "label", "end_loop"));
            default -> throw new IOException("Unknown HistoryEntry type: " + type);
        };
    }
}
