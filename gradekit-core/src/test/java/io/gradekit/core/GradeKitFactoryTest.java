package io.gradekit.core;

import static io.gradekit.core.Graders.field;
import static io.gradekit.core.Graders.grader;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.gradekit.core.extract.JsonCodec;
import io.gradekit.core.grader.model.FieldType;
import io.gradekit.core.grader.model.GraderType;
import io.gradekit.core.grader.result.EvaluationResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GradeKitFactoryTest {

    @Test
    void shouldCreateEngineWithDefaults() {
        assertThat(GradeKitFactory.createEngine()).isNotNull();
    }

    @Test
    void shouldUseExplicitCodecForJsonGraders() throws Exception {
        JsonCodec codec = mock(JsonCodec.class);
        when(codec.readObject(anyString())).thenReturn(Map.of("a", "yes"));

        GradingEngine engine = GradeKitFactory.createEngine(new GradingConfig(), codec);
        EvaluationResult result =
                engine.evaluateResponse(
                        "{\"a\":\"yes\"}",
                        List.of(grader(GraderType.JSON, "g", 1.0, field("a", FieldType.BOOLEAN, 1.0, true))));

        assertThat(result.getPercentageScore()).isEqualTo(100.0);
        verify(codec).readObject("{\"a\":\"yes\"}");
    }

    @Test
    void shouldValidateConfigurationValues() {
        assertThatThrownBy(() -> GradingConfig.builder().maxResponseBytes(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GradingConfig().setDefaultGraderWeight(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new GradingConfig().getMaxResponseBytes()).isEqualTo(1024 * 1024);
    }
}
