package io.interviews.core.questionnaire;

import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.InterviewStateException;
import io.interviews.core.exception.QuestionnaireValidationException;
import io.interviews.core.questionnaire.question.BeginLoopQuestion;
import io.interviews.core.questionnaire.question.EndLoopQuestion;
import io.interviews.core.questionnaire.question.Question;
import io.interviews.core.questionnaire.transition.Transition;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Compiled, validated questionnaire graph.
///
/// Questions are kept in structural order; every transition goes to a strictly later
/// question, so the graph is acyclic. Structural metadata (rank, loop nest, loop
/// pairing) is available per label through {@link #getInfo(String)}.
///
/// ### Contracts
/// - **Invariant**: labels and questions never change once built
/// - **Invariant**: the change counter increases on every accepted mutation
/// - **Invariant**: a locked questionnaire rejects every mutation
///
/// @implNote The graph is immutable and shared by all interviews. Only the name and
/// the lock flag are mutable; both are guarded by this instance's monitor.
///
/// @see io.interviews.core.compiler.QuestionnaireCompiler for construction from a source
public final class Questionnaire {

    private static final Logger logger = Logger.getLogger(Questionnaire.class.getName());

    private final String id;
    private final List<Question> questions;
    private final Map<String, Question> byLabel;
    private final Map<String, QuestionInfo> infos;

    private String name;
    private boolean locked;
    private long changeCount;
    private long orphansCheckedAt = -1;

    private Questionnaire(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Questionnaire ID required");
        this.name = Objects.requireNonNull(builder.name, "Questionnaire name required");
        this.questions = List.copyOf(builder.questions);
        this.infos = Map.copyOf(builder.infos);
        Map<String, Question> map = new LinkedHashMap<>();
        for (Question q : questions) {
            map.put(q.getLabel(), q);
            if (!infos.containsKey(q.getLabel())) {
                throw new IllegalStateException("Missing info for question " + q.getLabel());
            }
        }
        this.byLabel = Collections.unmodifiableMap(map);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public synchronized String getName() {
        return name;
    }

    /// Returns the questions in structural order.
    ///
    /// @return immutable list, never null, never empty
    public List<Question> getQuestions() {
        return questions;
    }

    public int size() {
        return questions.size();
    }

    /// Returns the first question, where every interview starts.
    ///
    /// @return first question, never null
    public Question getFirstQuestion() {
        return questions.get(0);
    }

    /// Looks up a question by label.
    ///
    /// @param label the label, not null
    /// @return the question if it exists
    public Optional<Question> findQuestion(String label) {
        return Optional.ofNullable(byLabel.get(label));
    }

    /// Looks up a question known to exist, such as a transition destination.
    ///
    /// @param label the label, not null
    /// @return the question, never null
    /// @throws IllegalStateException if absent, which indicates an engine defect
    public Question getQuestion(String label) {
        Question q = byLabel.get(label);
        if (q == null) {
            logger.severe("Questionnaire " + id + " has no question labeled " + label);
            throw new IllegalStateException("Unknown question label: " + label);
        }
        return q;
    }

    /// Returns the structural metadata of a question.
    ///
    /// @param label the label, not null
    /// @return metadata, never null
    /// @throws IllegalStateException if the label is unknown
    public QuestionInfo getInfo(String label) {
        QuestionInfo info = infos.get(label);
        if (info == null) {
            logger.severe("Questionnaire " + id + " has no info for label " + label);
            throw new IllegalStateException("Unknown question label: " + label);
        }
        return info;
    }

    /// Returns the end loop closing the given begin loop.
    ///
    /// @param beginLoop the begin loop, not null
    /// @return matching end loop, never null
    public EndLoopQuestion findMatchingEndLoop(BeginLoopQuestion beginLoop) {
        int rank = getInfo(beginLoop.getLabel()).rank();
        for (int i = rank + 1; i < questions.size(); i++) {
            Question q = questions.get(i);
            if (q instanceof EndLoopQuestion el
                    && beginLoop.getLabel().equals(infos.get(el.getLabel()).matchingBeginLoop())) {
                return el;
            }
        }
        logger.severe("Begin loop " + beginLoop.getLabel() + " has no matching end loop");
        throw new IllegalStateException("Unbalanced loop " + beginLoop.getLabel());
    }

    /// Returns the begin loop opened by the given end loop.
    ///
    /// @param endLoop the end loop, not null
    /// @return matching begin loop, never null
    public BeginLoopQuestion getMatchingBeginLoop(EndLoopQuestion endLoop) {
        return (BeginLoopQuestion) getQuestion(getInfo(endLoop.getLabel()).matchingBeginLoop());
    }

    /// Estimates completion when the given question is displayed.
    ///
    /// @param question question about to be displayed, not null
    /// @return percentage in `[0, 100]`, 100 for a final question
    public int progress(Question question) {
        if (question.isFinal()) {
            return 100;
        }
        return getInfo(question.getLabel()).rank() * 100 / questions.size();
    }

    public synchronized boolean isLocked() {
        return locked;
    }

    /// Locks the questionnaire once a campaign refers to it.
    public synchronized void lock() {
        if (!locked) {
            locked = true;
            logger.info("Questionnaire " + id + " locked");
        }
    }

    public synchronized long getChangeCount() {
        return changeCount;
    }

    /// Renames the questionnaire.
    ///
    /// @param newName the name, not null or blank
    /// @throws InterviewStateException if the questionnaire is locked
    public synchronized void rename(String newName) throws InterviewStateException {
        if (locked) {
            throw new InterviewStateException(ErrorCode.QUESTIONNAIRE_IS_LOCKED);
        }
        if (newName == null || newName.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        name = newName;
        changeCount++;
    }

    /// Creates an unlocked copy sharing the immutable graph.
    ///
    /// @param newId the copy's id, not null
    /// @return new questionnaire, never null
    public Questionnaire copy(String newId) {
        return builder()
                .id(newId)
                .name(getName())
                .questions(questions)
                .infos(infos)
                .build();
    }

    /// Checks that every question but the first is the destination of a transition.
    ///
    /// The result is memoized by the change counter.
    ///
    /// @throws QuestionnaireValidationException naming the first orphan
    public synchronized void checkOrphans() throws QuestionnaireValidationException {
        if (orphansCheckedAt == changeCount) {
            return;
        }
        Set<String> destinations = new HashSet<>();
        for (Question q : questions) {
            for (Transition t : q.getTransitions()) {
                destinations.add(t.getDestination());
            }
        }
        for (int i = 1; i < questions.size(); i++) {
            String label = questions.get(i).getLabel();
            if (!destinations.contains(label)) {
                throw new QuestionnaireValidationException(ErrorCode.QUESTION_IS_ORPHAN, label);
            }
        }
        orphansCheckedAt = changeCount;
    }

    @Override
    public String toString() {
        return "Questionnaire{id='" + id + "', questions=" + questions.size() + "}";
    }

    /// Builder for questionnaires. Required fields: `id`, `name`, `questions`, `infos`.
    public static final class Builder {
        private String id;
        private String name;
        private List<Question> questions = List.of();
        private Map<String, QuestionInfo> infos = Map.of();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder questions(List<Question> questions) {
            this.questions = questions;
            return this;
        }

        public Builder infos(Map<String, QuestionInfo> infos) {
            this.infos = infos;
            return this;
        }

        /// Builds the questionnaire.
        ///
        /// @return new questionnaire, never null
        /// @throws IllegalStateException if there are no questions
        public Questionnaire build() {
            if (questions == null || questions.isEmpty()) {
                throw new IllegalStateException("Questionnaire needs at least one question");
            }
            return new Questionnaire(this);
        }
    }
}
