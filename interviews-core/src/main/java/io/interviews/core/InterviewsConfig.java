package io.interviews.core;

import io.interviews.core.execution.ExecutionContext;
import java.time.Clock;
import java.util.Properties;

/// Configuration options for the interviews environment.
///
/// Use the {@link Builder} for fluent configuration, {@link #fromProperties} to read
/// `interviews.*` keys, or construct directly and use the setters.
///
/// ### Default Values
/// - `defaultLanguage`: `"en"`, used when an interview is started without a language
/// - `maxLoopIterations`: `1000`, largest operand array a loop may iterate over
/// - `storageType`: `"memory"` (in-memory repositories)
/// - `clock`: the system UTC clock
///
/// ### Property keys
/// | Key | Setting |
/// |---|---|
/// | `interviews.default-language` | default language |
/// | `interviews.max-loop-iterations` | loop iteration guard |
/// | `interviews.storage-type` | storage backend |
///
/// @implNote **Not thread-safe**. Configure before passing to {@link InterviewsFactory}
/// and do not modify afterwards.
///
/// @see InterviewsFactory#createEnvironment(InterviewsConfig)
public class InterviewsConfig {

    public static final String PREFIX = "interviews.";

    private String defaultLanguage = "en";
    private int maxLoopIterations = ExecutionContext.DEFAULT_MAX_LOOP_ITERATIONS;
    private String storageType = "memory";
    private Clock clock = Clock.systemUTC();

    /// Creates a configuration with default values.
    public InterviewsConfig() {}

    /// Reads a configuration from properties, keeping defaults for absent keys.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if `interviews.max-loop-iterations` is not a
    ///     positive integer
    public static InterviewsConfig fromProperties(Properties properties) {
        InterviewsConfig config = new InterviewsConfig();
        String language = properties.getProperty(PREFIX + "default-language");
        if (language != null && !language.isBlank()) {
            config.setDefaultLanguage(language.trim());
        }
        String iterations = properties.getProperty(PREFIX + "max-loop-iterations");
        if (iterations != null && !iterations.isBlank()) {
            try {
                config.setMaxLoopIterations(Integer.parseInt(iterations.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid " + PREFIX + "max-loop-iterations: " + iterations, e);
            }
        }
        String storage = properties.getProperty(PREFIX + "storage-type");
        if (storage != null && !storage.isBlank()) {
            config.setStorageType(storage.trim());
        }
        return config;
    }

    /// Returns the language used when an interview starts without one.
    ///
    /// @return ISO 639-1 code, never null
    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public void setDefaultLanguage(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }

    /// Returns the largest operand array a loop may iterate over.
    ///
    /// @return positive bound
    public int getMaxLoopIterations() {
        return maxLoopIterations;
    }

    /// Sets the loop iteration guard.
    ///
    /// ### Contracts
    /// - **Precondition**: `maxLoopIterations` is positive
    ///
    /// @param maxLoopIterations the bound
    /// @throws IllegalArgumentException if not positive
    public void setMaxLoopIterations(int maxLoopIterations) {
        if (maxLoopIterations <= 0) {
            throw new IllegalArgumentException("maxLoopIterations must be positive");
        }
        this.maxLoopIterations = maxLoopIterations;
    }

    /// Returns the storage backend type.
    ///
    /// @return storage type identifier, never null. Only `"memory"` ships with the core
    public String getStorageType() {
        return storageType;
    }

    public void setStorageType(String storageType) {
        this.storageType = storageType;
    }

    /// Returns the clock stamping answers and checking campaign periods.
    ///
    /// @return the clock, never null
    public Clock getClock() {
        return clock;
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link InterviewsConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final InterviewsConfig config = new InterviewsConfig();

        public Builder defaultLanguage(String defaultLanguage) {
            config.setDefaultLanguage(defaultLanguage);
            return this;
        }

        public Builder maxLoopIterations(int maxLoopIterations) {
            config.setMaxLoopIterations(maxLoopIterations);
            return this;
        }

        public Builder storageType(String storageType) {
            config.setStorageType(storageType);
            return this;
        }

        /// Sets the clock, typically a fixed one in tests.
        ///
        /// @param clock the clock, not null
        /// @return this builder for chaining, never null
        public Builder clock(Clock clock) {
            config.setClock(clock);
            return this;
        }

        /// Builds and returns the configured {@link InterviewsConfig} instance.
        ///
        /// @return the configured instance, never null
        public InterviewsConfig build() {
            return config;
        }
    }
}
