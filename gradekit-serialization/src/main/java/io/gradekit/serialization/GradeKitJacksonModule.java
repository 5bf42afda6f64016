package io.gradekit.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.gradekit.core.GradingConfig;
import io.gradekit.core.grader.model.GraderConfig;
import io.gradekit.core.grader.result.EvaluationResult;
import io.gradekit.core.grader.result.GraderResult;
import io.gradekit.core.task.TaskDefinition;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all GradeKit serialization configuration in one place.
///
/// **Configuration types** (read and written):
/// - `GraderConfig` - `GraderConfigSerializer` / `GraderConfigDeserializer`, both legacy
///   field shapes
/// - `TaskDefinition` - `TaskDefinitionSerializer` / `TaskDefinitionDeserializer`
///
/// **Result types** (written only):
/// - `EvaluationResult` - `EvaluationResultSerializer`
/// - `GraderResult` - `GraderResultSerializer`, field details included
///
/// @implNote All registrations are explicit. No reflection-based binding is used for domain
/// types, so builder classes need no Jackson annotations.
/// @see GradeKitSerializer for the convenience factory API
public class GradeKitJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4470290383563911782L;

    public GradeKitJacksonModule() {
        this(new GradingConfig());
    }

    /// Constructs the module with a custom default grader weight for loaded configuration.
    ///
    /// @param config supplies the weight given to graders that declare none, not null
    public GradeKitJacksonModule(GradingConfig config) {
        super("GradeKitJacksonModule");

        addSerializer(GraderConfig.class, new GraderConfigSerializer());
        addDeserializer(GraderConfig.class, new GraderConfigDeserializer(config));

        addSerializer(TaskDefinition.class, new TaskDefinitionSerializer());
        addDeserializer(TaskDefinition.class, new TaskDefinitionDeserializer(config));

        addSerializer(EvaluationResult.class, new EvaluationResultSerializer());
        addSerializer(GraderResult.class, new GraderResultSerializer());
    }
}
