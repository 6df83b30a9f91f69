package io.interviews.core.questionnaire.question;

import io.interviews.core.questionnaire.transition.ScriptFunction;
import java.util.List;
import java.util.Objects;

/// Body shared by Select and the four multiple-choice kinds.
///
/// The option count is fixed at compile time; localizations must match it. For
/// multiple-choice kinds `limit` is the maximum (AT_MOST) or exact (LIMIT) number of
/// choices, always in `[2, options.size()]`. Select ignores it.
///
/// @param style display style, not null
/// @param options the options in display order, not null
/// @param randomize whether clients should shuffle the options
/// @param hasComment whether a general comment may accompany the choice
/// @param limit number of choices for multiple-choice kinds
/// @param functions text functions, not null
public record OptionsBody(
        String style,
        List<Option> options,
        boolean randomize,
        boolean hasComment,
        int limit,
        List<ScriptFunction> functions)
        implements QuestionBody {

    public OptionsBody {
        Objects.requireNonNull(style, "style must not be null");
        options = List.copyOf(options);
        functions = List.copyOf(functions);
    }

    public OptionsBody(
            String style, List<Option> options, boolean randomize, boolean hasComment, int limit) {
        this(style, options, randomize, hasComment, limit, List.of());
    }

    @Override
    public OptionsBody withFunctions(List<ScriptFunction> functions) {
        return new OptionsBody(style, options, randomize, hasComment, limit, functions);
    }
}
