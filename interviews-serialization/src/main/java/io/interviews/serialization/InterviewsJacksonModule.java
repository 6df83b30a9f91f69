package io.interviews.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.interviews.core.compiler.SourceQuestion;
import io.interviews.core.execution.history.History;
import io.interviews.core.execution.history.HistoryEntry;
import io.interviews.core.interview.AnswerBody;
import io.interviews.core.interview.Interview;
import io.interviews.serialization.mixin.InterviewMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all interviews serialization configuration in one
/// place.
///
/// **Custom serializer/deserializer pairs** (sealed hierarchies, the discriminator field
/// drives subtype selection):
/// - `SourceQuestion`, discriminator `"type"` holding the question kind's wire name
/// - `AnswerBody`, discriminator `"type"`: `message`, `input`, `select`, `multiple_choice`
/// - `HistoryEntry`, discriminator `"type"`: `answer`, `begin_loop`, `end_loop`
/// - `History`, written as the plain array of its entries
///
/// Records (`SourceQuestionnaire`, `Answer`, `InterviewData`, `QuestionView`, ...) bind
/// through their canonical constructors and need no registration.
///
/// **Mixins**:
/// - `Interview`, field visibility so the persisted form restores state and history
///
/// @see InterviewsSerializer for the convenience factory API
public class InterviewsJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3126719027543361942L;

    public InterviewsJacksonModule() {
        super("InterviewsJacksonModule");

        addSerializer(SourceQuestion.class, new SourceQuestionSerializer());
        addDeserializer(SourceQuestion.class, new SourceQuestionDeserializer());

        addSerializer(AnswerBody.class, new AnswerBodySerializer());
        addDeserializer(AnswerBody.class, new AnswerBodyDeserializer());

        addSerializer(HistoryEntry.class, new HistoryEntrySerializer());
        addDeserializer(HistoryEntry.class, new HistoryEntryDeserializer());

        addSerializer(History.class, new HistorySerializer());
        addDeserializer(History.class, new HistoryDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Interview.class, InterviewMixin.class);
    }
}
