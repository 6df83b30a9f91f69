package io.interviews.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.interviews.core.interview.AnswerBody;
import io.interviews.core.interview.AnswerBody.InputAnswer;
import io.interviews.core.interview.AnswerBody.MessageAnswer;
import io.interviews.core.interview.AnswerBody.MultipleChoiceAnswer;
import io.interviews.core.interview.AnswerBody.SelectAnswer;
import io.interviews.core.interview.Choice;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `AnswerBody` sealed hierarchy with a `"type"` discriminator field.
///
/// - **`MessageAnswer`**: `{"type":"message"}`
/// - **`InputAnswer`**: `{"type":"input","input":"...","comment":"..."}`
/// - **`SelectAnswer`**: `{"type":"select","choice":{"index":N,"comment":"..."},"comment":"..."}`
/// - **`MultipleChoiceAnswer`**: `{"type":"multiple_choice","choices":[...],"comment":"..."}`
///
/// @see AnswerBodyDeserializer for the inverse operation
class AnswerBodySerializer extends StdSerializer<AnswerBody> {

    @Serial private static final long serialVersionUID = 2417795302786017359L;

    AnswerBodySerializer() {
        super(AnswerBody.class);
    }

    @Override
    public void serialize(AnswerBody body, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (body instanceof MessageAnswer) {
            gen.writeStringField("type", "message");
        } else if (body instanceof InputAnswer input) {
            gen.writeStringField("type", "input");
            gen.writeStringField("input", input.input());
        } else if (body instanceof SelectAnswer select) {
            gen.writeStringField("type", "select");
            gen.writeFieldName("choice");
            writeChoice(select.choice(), gen);
        } else if (body instanceof MultipleChoiceAnswer multiple) {
            gen.writeStringField("type", "multiple_choice");
            gen.writeArrayFieldStart("choices");
            for (Choice choice : multiple.choices()) {
                writeChoice(choice, gen);
            }
            gen.writeEndArray();
        }
        if (!(body instanceof MessageAnswer)) {
            gen.writeStringField("comment", body.comment());
        }
        gen.writeEndObject();
    }

    private static void writeChoice(Choice choice, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("index", choice.index());
        gen.writeStringField("comment", choice.comment());
        gen.writeEndObject();
    }
}
