package io.gradekit.core;

import io.gradekit.core.compare.ComparatorRegistry;
import io.gradekit.core.compare.DefaultComparatorRegistry;
import io.gradekit.core.extract.JsonCodec;
import io.gradekit.core.grader.AggregateScorer;
import io.gradekit.core.grader.GraderEvaluator;
import java.util.Iterator;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/// Factory for creating and wiring {@link GradingEngine} instances.
///
/// ### Codec Discovery
/// Core reads JSON through a {@link JsonCodec}. Unless one is passed explicitly, the first
/// implementation registered in `META-INF/services/io.gradekit.core.extract.JsonCodec` is
/// used. Without any codec, `json` graders report every response as unreadable.
///
/// ### Usage
/// {@snippet :
/// // discovered codec, default limits
/// GradingEngine engine = GradeKitFactory.createEngine();
///
/// // explicit configuration
/// GradingEngine strict = GradeKitFactory.createEngine(
///     GradingConfig.builder().maxResponseBytes(64 * 1024).build());
/// }
///
/// @implNote Utility class with only static methods.
///
/// @see GradingConfig
public final class GradeKitFactory {

    private static final Logger logger = Logger.getLogger(GradeKitFactory.class.getName());

    private GradeKitFactory() {}

    /// Creates an engine with default configuration and a discovered codec.
    ///
    /// @return configured engine, never null
    public static GradingEngine createEngine() {
        return createEngine(new GradingConfig());
    }

    /// Creates an engine with custom configuration and a discovered codec.
    ///
    /// @param config engine configuration, not null
    /// @return configured engine, never null
    public static GradingEngine createEngine(GradingConfig config) {
        return createEngine(config, discoverJsonCodec().orElse(null));
    }

    /// Creates an engine with custom configuration and an explicit codec.
    ///
    /// @param config engine configuration, not null
    /// @param codec JSON codec, may be null
    /// @return configured engine, never null
    public static GradingEngine createEngine(GradingConfig config, JsonCodec codec) {
        return createEngine(config, codec, DefaultComparatorRegistry.withDefaults());
    }

    /// Creates an engine with every collaborator supplied.
    ///
    /// Useful for tests and for registering custom comparators.
    ///
    /// @param config engine configuration, not null
    /// @param codec JSON codec, may be null
    /// @param comparators comparator lookup, not null
    /// @return configured engine, never null
    public static GradingEngine createEngine(
            GradingConfig config, JsonCodec codec, ComparatorRegistry comparators) {
        if (codec == null) {
            logger.warning("No JsonCodec available; json graders will not be able to read responses");
        }
        GraderEvaluator evaluator = new GraderEvaluator(comparators, codec, config);
        logger.info(
                "Grading engine created (maxResponseBytes="
                        + config.getMaxResponseBytes()
                        + ", codec="
                        + (codec != null ? codec.getClass().getSimpleName() : "none")
                        + ")");
        return new GradingEngine(evaluator, new AggregateScorer());
    }

    /// Finds the first {@link JsonCodec} registered through {@link ServiceLoader}.
    ///
    /// @return discovered codec, or empty if none is on the class path
    public static Optional<JsonCodec> discoverJsonCodec() {
        Iterator<JsonCodec> codecs = ServiceLoader.load(JsonCodec.class).iterator();
        if (!codecs.hasNext()) {
            return Optional.empty();
        }
        JsonCodec codec = codecs.next();
        logger.fine("Discovered JSON codec: " + codec.getClass().getName());
        return Optional.of(codec);
    }
}
