package io.interviews.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.interviews.core.compiler.SourceFunction;
import io.interviews.core.compiler.SourceOption;
import io.interviews.core.compiler.SourceQuestion;
import io.interviews.core.compiler.SourceText;
import io.interviews.core.compiler.SourceTransition;
import io.interviews.core.questionnaire.question.QuestionKind;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Deserializes `SourceQuestion` variants based on the `type` discriminator field.
///
/// Fields are read leniently: absent strings become empty, absent lists empty and absent
/// flags false, leaving the structural checks to the compiler. Only a missing or unknown
/// `type` fails here.
///
/// A `text` given as a plain string is accepted as a text without functions.
///
/// @see SourceQuestionSerializer for the inverse operation
class SourceQuestionDeserializer extends StdDeserializer<SourceQuestion> {

    @Serial private static final long serialVersionUID = 7703520384219617055L;

    SourceQuestionDeserializer() {
        super(SourceQuestion.class);
    }

    @Override
    public SourceQuestion deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        JsonNode root = ctx.readTree(p);

        String type = JsonNodes.requiredText(root, "type", "SourceQuestion");
        String label = JsonNodes.text(root, "label");
        List<SourceTransition> transitions = readTransitions(root.get("transitions"));

        return switch (type) {
            case "message" ->
                    new SourceQuestion.Message(
                            label, readText(root.get("text")), JsonNodes.text(root, "style"),
                            transitions);
            case "input" ->
                    new SourceQuestion.Input(
                            label,
                            readText(root.get("text")),
                            JsonNodes.text(root, "style"),
                            JsonNodes.text(root, "commentLabel"),
                            root.path("optional").asBoolean(false),
                            transitions);
            case "from_template" ->
                    new SourceQuestion.FromTemplate(
                            label, JsonNodes.text(root, "templateName"), transitions);
            case "begin_loop" ->
                    new SourceQuestion.BeginLoop(
                            label,
                            JsonNodes.text(root, "operandLabel"),
                            JsonNodes.text(root, "operandCode"),
                            JsonNodes.text(root, "variable"),
                            transitions);
            case "end_loop" -> new SourceQuestion.EndLoop(label, transitions);
            default -> {
                QuestionKind kind = optionKind(type);
                yield new SourceQuestion.WithOptions(
                        label,
                        kind,
                        readText(root.get("text")),
                        JsonNodes.text(root, "style"),
                        JsonNodes.text(root, "commentLabel"),
                        root.path("randomize").asBoolean(false),
                        root.path("limit").asInt(0),
                        readOptions(root.get("options")),
                        transitions);
            }
        };
    }

    private static QuestionKind optionKind(String type) throws IOException {
        QuestionKind kind;
        try {
            kind = QuestionKind.fromWireName(type);
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown SourceQuestion type: " + type, e);
        }
        if (!kind.hasOptions()) {
            throw new IOException("Unknown SourceQuestion type: " + type);
        }
        return kind;
    }

    private static SourceText readText(JsonNode node) {
        if (node == null || node.isNull()) {
            return new SourceText("");
        }
        if (node.isTextual()) {
            return new SourceText(node.asText());
        }
        List<SourceFunction> functions = new ArrayList<>();
        JsonNode array = node.get("functions");
        if (array != null) {
            for (JsonNode f : array) {
                functions.add(
                        new SourceFunction(
                                JsonNodes.text(f, "code"), JsonNodes.strings(f, "parameters")));
            }
        }
        return new SourceText(JsonNodes.text(node, "value"), functions);
    }

    private static List<SourceOption> readOptions(JsonNode array) {
        List<SourceOption> options = new ArrayList<>();
        if (array != null) {
            for (JsonNode o : array) {
                options.add(
                        o.isTextual()
                                ? new SourceOption(o.asText())
                                : new SourceOption(
                                        JsonNodes.text(o, "label"),
                                        JsonNodes.text(o, "commentLabel")));
            }
        }
        return options;
    }

    private static List<SourceTransition> readTransitions(JsonNode array) {
        List<SourceTransition> transitions = new ArrayList<>();
        if (array != null) {
            for (JsonNode t : array) {
                transitions.add(
                        new SourceTransition(
                                JsonNodes.text(t, "destination"),
                                JsonNodes.text(t, "condition"),
                                JsonNodes.text(t, "code"),
                                JsonNodes.strings(t, "parameters")));
            }
        }
        return transitions;
    }
}
