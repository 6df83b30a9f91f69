package io.interviews.graaljs;

import io.interviews.core.expression.EvaluationScope;
import io.interviews.core.expression.ExpressionEvaluator;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.ResourceLimits;
import org.graalvm.polyglot.Source;

/// GraalJS implementation of {@link ExpressionEvaluator}.
///
/// Every scope gets a fresh JavaScript context, so nothing declared or assigned by one
/// evaluation leaks into the next. The contexts share one {@link Engine}, which keeps
/// parsed sources (the helper library included) across contexts.
///
/// ### Sandbox
/// - no host access and no host class lookup: scripts only see declared JSON values
/// - no I/O, threads or native access (polyglot defaults)
/// - a statement limit per scope, so a looping script fails instead of hanging
///
/// The helper library `interview-library.js` is loaded into each context before the
/// declarations.
///
/// @implNote Thread-safe. The engine is shared; each scope's context is confined to the
/// thread that opened it.
///
/// @see GraalJsEvaluationScope for value conversion
public class GraalJsExpressionEvaluator implements ExpressionEvaluator {

    private static final Logger logger =
            Logger.getLogger(GraalJsExpressionEvaluator.class.getName());

    /// Statements one scope may run before it is cancelled.
    public static final long DEFAULT_STATEMENT_LIMIT = 1_000_000L;

    private static final String LIBRARY = "interview-library.js";

    private final Engine engine;
    private final Source library;
    private final ResourceLimits limits;

    /// Creates an evaluator with the default statement limit. Used by `ServiceLoader`.
    public GraalJsExpressionEvaluator() {
        this(DEFAULT_STATEMENT_LIMIT);
    }

    /// Creates an evaluator.
    ///
    /// @param statementLimit statements one scope may run, positive
    /// @throws IllegalArgumentException if the limit is not positive
    /// @throws IllegalStateException if the helper library cannot be loaded
    public GraalJsExpressionEvaluator(long statementLimit) {
        if (statementLimit <= 0) {
            throw new IllegalArgumentException("statementLimit must be positive");
        }
        this.engine = Engine.newBuilder().option("engine.WarnInterpreterOnly", "false").build();
        this.library = loadLibrary();
        this.limits = ResourceLimits.newBuilder().statementLimit(statementLimit, null).build();
        logger.info("GraalJS evaluator ready (statement limit " + statementLimit + ")");
    }

    @Override
    public String getName() {
        return "graaljs";
    }

    @Override
    public int getPriority() {
        return 0;
    }

    @Override
    public EvaluationScope openScope() {
        Context context =
                Context.newBuilder("js")
                        .engine(engine)
                        .allowHostAccess(HostAccess.NONE)
                        .allowHostClassLookup(className -> false)
                        .allowAllAccess(false)
                        .resourceLimits(limits)
                        .build();
        try {
            context.eval(library);
        } catch (RuntimeException e) {
            context.close();
            throw e;
        }
        return new GraalJsEvaluationScope(context);
    }

    /// Closes the shared engine. Scopes still open are cancelled.
    @Override
    public void close() {
        engine.close(true);
        logger.fine("GraalJS engine closed");
    }

    private static Source loadLibrary() {
        try (InputStream in = GraalJsExpressionEvaluator.class.getResourceAsStream(LIBRARY)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + LIBRARY);
            }
            String code = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return Source.newBuilder("js", code, LIBRARY).cached(true).build();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load " + LIBRARY, e);
        }
    }
}
