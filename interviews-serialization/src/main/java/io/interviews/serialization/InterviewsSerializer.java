package io.interviews.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.interviews.core.compiler.SourceQuestionnaire;
import io.interviews.core.interview.AnswerBody;
import io.interviews.core.interview.Interview;
import io.interviews.core.interview.InterviewData;

/// Utility class for reading and writing interviews payloads as JSON.
///
/// Provides a pre-configured `ObjectMapper` for the source upload format, answer bodies,
/// persisted interviews and interview exports.
///
/// ### Usage
/// {@snippet :
/// SourceQuestionnaire source = InterviewsSerializer.questionnaireFromJson(upload);
/// Compilation compilation = service.compile(source);
///
/// String export = InterviewsSerializer.toJson(service.exportInterview(id));
/// }
///
/// @implNote Thread-safe. The mapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see InterviewsJacksonModule for the registered type handlers
public final class InterviewsSerializer {

    private InterviewsSerializer() {}

    /// Serializes any interviews payload to pretty-printed JSON.
    ///
    /// @param value the value, e.g. a {@link SourceQuestionnaire}, {@link Interview} or
    ///     {@link InterviewData}, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Object value) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + value.getClass().getSimpleName() + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /// Reads an uploaded source questionnaire.
    ///
    /// @param json JSON string, not null
    /// @return the source, never null; structural validity is left to the compiler
    /// @throws IllegalArgumentException if the JSON is malformed or names an unknown
    ///     question type
    public static SourceQuestionnaire questionnaireFromJson(String json) {
        return fromJson(json, SourceQuestionnaire.class);
    }

    /// Reads an answer body as submitted by a client.
    ///
    /// @param json JSON string, not null
    /// @return the body, never null
    /// @throws IllegalArgumentException if the JSON is malformed
    public static AnswerBody answerBodyFromJson(String json) {
        return fromJson(json, AnswerBody.class);
    }

    /// Restores a persisted interview with its history.
    ///
    /// @param json JSON string produced by {@link #toJson(Object)}, not null
    /// @return the interview, never null
    /// @throws IllegalArgumentException if the JSON is malformed
    public static Interview interviewFromJson(String json) {
        return fromJson(json, Interview.class);
    }

    private static <T> T fromJson(String json, Class<T> type) {
        try {
            return createMapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for interviews serialization.
    ///
    /// Registers:
    /// - `InterviewsJacksonModule` for the sealed hierarchies and the interview mixin
    /// - `JavaTimeModule` for `Instant` and `Duration` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new InterviewsJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
