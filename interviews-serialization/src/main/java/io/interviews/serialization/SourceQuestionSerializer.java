package io.interviews.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.interviews.core.compiler.SourceFunction;
import io.interviews.core.compiler.SourceOption;
import io.interviews.core.compiler.SourceQuestion;
import io.interviews.core.compiler.SourceQuestion.BeginLoop;
import io.interviews.core.compiler.SourceQuestion.EndLoop;
import io.interviews.core.compiler.SourceQuestion.FromTemplate;
import io.interviews.core.compiler.SourceQuestion.Input;
import io.interviews.core.compiler.SourceQuestion.Message;
import io.interviews.core.compiler.SourceQuestion.WithOptions;
import io.interviews.core.compiler.SourceText;
import io.interviews.core.compiler.SourceTransition;
import java.io.IOException;
import java.io.Serial;
import java.util.List;

/// Serializes the `SourceQuestion` sealed hierarchy with a `"type"` discriminator holding
/// the question kind's wire name.
///
/// Common fields: `type`, `label`, `transitions`. Per subtype:
/// - **`Message`**: `text`, `style`
/// - **`Input`**: `text`, `style`, `commentLabel`, `optional`
/// - **`WithOptions`** (`select`, `select_at_most`, `select_limit`, `rank_at_most`,
///   `rank_limit`): `text`, `style`, `commentLabel`, `randomize`, `limit`, `options`
/// - **`FromTemplate`**: `templateName`
/// - **`BeginLoop`**: `operandLabel`, `operandCode`, `variable`
/// - **`EndLoop`**: nothing more
///
/// A text is `{"value":"...","functions":[{"code":"...","parameters":[...]}]}`, a
/// transition `{"destination":"...","condition":"...","code":"...","parameters":[...]}`.
///
/// @see SourceQuestionDeserializer for the inverse operation
class SourceQuestionSerializer extends StdSerializer<SourceQuestion> {

    @Serial private static final long serialVersionUID = -3409145860870736231L;

    SourceQuestionSerializer() {
        super(SourceQuestion.class);
    }

    @Override
    public void serialize(SourceQuestion question, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", question.kind().getWireName());
        gen.writeStringField("label", question.label());

        if (question instanceof Message m) {
            writeText(m.text(), gen);
            gen.writeStringField("style", m.style());
        } else if (question instanceof Input i) {
            writeText(i.text(), gen);
            gen.writeStringField("style", i.style());
            gen.writeStringField("commentLabel", i.commentLabel());
            gen.writeBooleanField("optional", i.optional());
        } else if (question instanceof WithOptions w) {
            writeText(w.text(), gen);
            gen.writeStringField("style", w.style());
            gen.writeStringField("commentLabel", w.commentLabel());
            gen.writeBooleanField("randomize", w.randomize());
            gen.writeNumberField("limit", w.limit());
            gen.writeArrayFieldStart("options");
            for (SourceOption option : w.options()) {
                gen.writeStartObject();
                gen.writeStringField("label", option.label());
                gen.writeStringField("commentLabel", option.commentLabel());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        } else if (question instanceof FromTemplate t) {
            gen.writeStringField("templateName", t.templateName());
        } else if (question instanceof BeginLoop b) {
            gen.writeStringField("operandLabel", b.operandLabel());
            gen.writeStringField("operandCode", b.operandCode());
            gen.writeStringField("variable", b.variable());
        } else if (!(question instanceof EndLoop)) {
            throw new IOException("Unsupported SourceQuestion: " + question.getClass());
        }

        gen.writeArrayFieldStart("transitions");
        for (SourceTransition t : question.transitions()) {
            gen.writeStartObject();
            gen.writeStringField("destination", t.destination());
            gen.writeStringField("condition", t.condition());
            gen.writeStringField("code", t.code());
            writeStrings("parameters", t.parameters(), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }

    private static void writeText(SourceText text, JsonGenerator gen) throws IOException {
        gen.writeObjectFieldStart("text");
        gen.writeStringField("value", text.value());
        gen.writeArrayFieldStart("functions");
        for (SourceFunction f : text.functions()) {
            gen.writeStartObject();
            gen.writeStringField("code", f.code());
            writeStrings("parameters", f.parameters(), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private static void writeStrings(String field, List<String> values, JsonGenerator gen)
            throws IOException {
        gen.writeArrayFieldStart(field);
        for (String value : values) {
            gen.writeString(value);
        }
        gen.writeEndArray();
    }
}
