package io.interviews.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.interviews.core.interview.AnswerBody;
import io.interviews.core.interview.Choice;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Deserializes `AnswerBody` variants based on the `type` discriminator field.
///
/// Absent `comment` fields read as empty. A choice without `index` is rejected rather
/// than defaulted to the first option.
///
/// @see AnswerBodySerializer for the inverse operation
class AnswerBodyDeserializer extends StdDeserializer<AnswerBody> {

    @Serial private static final long serialVersionUID = -6190187405722391488L;

    AnswerBodyDeserializer() {
        super(AnswerBody.class);
    }

    @Override
    public AnswerBody deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        JsonNode root = ctx.readTree(p);

        String type = JsonNodes.requiredText(root, "type", "AnswerBody");
        String comment = JsonNodes.text(root, "comment");

        return switch (type) {
            case "message" -> new AnswerBody.MessageAnswer();
            case "input" -> new AnswerBody.InputAnswer(JsonNodes.text(root, "input"), comment);
            case "select" -> new AnswerBody.SelectAnswer(readChoice(root.get("choice")), comment);
            case "multiple_choice" -> {
                List<Choice> choices = new ArrayList<>();
                JsonNode array = root.get("choices");
                if (array != null) {
                    for (JsonNode c : array) {
                        choices.add(readChoice(c));
                    }
                }
                yield new AnswerBody.MultipleChoiceAnswer(choices, comment);
            }
            default -> throw new IOException("Unknown AnswerBody type: " + type);
        };
    }

    private static Choice readChoice(JsonNode node) throws IOException {
        if (node == null || !node.hasNonNull("index")) {
            throw new IOException("Choice without index");
        }
        return new Choice(node.get("index").asInt(), JsonNodes.text(node, "comment"));
    }
}
