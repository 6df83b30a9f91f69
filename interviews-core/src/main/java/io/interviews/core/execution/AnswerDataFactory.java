package io.interviews.core.execution;

import io.interviews.core.interview.Answer;
import io.interviews.core.interview.AnswerBody;
import io.interviews.core.interview.AnswerBody.InputAnswer;
import io.interviews.core.interview.AnswerBody.MultipleChoiceAnswer;
import io.interviews.core.interview.AnswerBody.SelectAnswer;
import io.interviews.core.interview.Choice;
import io.interviews.core.interview.Geolocation;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Builds the language independent view of an answer.
///
/// This is what transition conditions see and what interview exports contain, so both
/// operate on the same data. The view is a JSON-like tree:
///
/// {@snippet lang=json :
/// {"label": "q1", "ip_address": "10.0.0.1", "timestamp": 1700000000,
///  "elapsed": 12, "total_elapsed": 40, "geolocation": null,
///  "comment": "", "choice": {"index": 1, "comment": ""}}
/// }
///
/// Times are whole seconds.
public final class AnswerDataFactory {

    private AnswerDataFactory() {}

    /// Builds the answer data of an answer.
    ///
    /// @param answer the answer, not null
    /// @return mutable JSON-like map, never null
    public static Map<String, Object> answerData(Answer answer) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("label", answer.label());
        data.put("ip_address", answer.ipAddress());
        data.put("timestamp", answer.timestamp().getEpochSecond());
        data.put("elapsed", answer.elapsed().getSeconds());
        data.put("total_elapsed", answer.totalElapsed().getSeconds());
        data.put("geolocation", geolocation(answer.geolocation()));
        putBody(data, answer.body());
        return data;
    }

    /// Adds the kind specific fields of a body.
    ///
    /// Shared with the localized view, which carries the same comment and choices.
    static void putBody(Map<String, Object> data, AnswerBody body) {
        if (body instanceof AnswerBody.MessageAnswer) {
            return;
        }
        data.put("comment", body.comment());
        if (body instanceof InputAnswer input) {
            data.put("input", input.input());
        } else if (body instanceof SelectAnswer select) {
            data.put("choice", choice(select.choice()));
        } else if (body instanceof MultipleChoiceAnswer multiple) {
            List<Object> choices = new ArrayList<>(multiple.choices().size());
            for (Choice c : multiple.choices()) {
                choices.add(choice(c));
            }
            data.put("choices", choices);
        }
    }

    static Map<String, Object> choice(Choice choice) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("index", choice.index());
        m.put("comment", choice.comment());
        return m;
    }

    private static Map<String, Object> geolocation(Geolocation geolocation) {
        if (geolocation == null) {
            return null;
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("latitude", geolocation.latitude());
        m.put("longitude", geolocation.longitude());
        return m;
    }
}
