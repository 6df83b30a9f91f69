package io.interviews.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.interviews.core.execution.history.History;

/// Jackson mixin persisting `Interview` through its fields.
///
/// `Interview` exposes its state through getters with `Optional` and derived values, and
/// mutates only through lifecycle methods. Field visibility reads and writes the raw
/// state; the identity fields and the history are final and go through the restoring
/// constructor.
///
/// @see io.interviews.serialization.InterviewsJacksonModule
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public abstract class InterviewMixin {

    @JsonCreator
    InterviewMixin(
            @JsonProperty("id") String id,
            @JsonProperty("campaignId") String campaignId,
            @JsonProperty("questionnaireId") String questionnaireId,
            @JsonProperty("history") History history) {}
}
