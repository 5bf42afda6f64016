package io.gradekit.core.grader;

import static io.gradekit.core.Graders.field;
import static io.gradekit.core.Graders.grader;
import static io.gradekit.core.Graders.xml;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import io.gradekit.core.GradingConfig;
import io.gradekit.core.compare.DefaultComparatorRegistry;
import io.gradekit.core.extract.ExtractionOutcome.FailureKind;
import io.gradekit.core.extract.JsonCodec;
import io.gradekit.core.extract.JsonCodecException;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.ComparatorType;
import io.gradekit.core.grader.model.FieldType;
import io.gradekit.core.grader.model.GraderConfig;
import io.gradekit.core.grader.model.GraderType;
import io.gradekit.core.grader.result.FieldResult;
import io.gradekit.core.grader.result.GraderResult;
import io.gradekit.core.response.ResponsePayload;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GraderEvaluatorTest {

    @Mock private JsonCodec codec;

    private GraderEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator =
                new GraderEvaluator(
                        DefaultComparatorRegistry.withDefaults(), codec, new GradingConfig());
    }

    @Test
    void shouldSumWeightsOfPassedFields() throws Exception {
        GraderConfig grader =
                xml(
                        "answers",
                        field("a", FieldType.INT, 2.0, 1),
                        field("b", FieldType.INT, 3.0, 2));

        GraderResult result =
                evaluator.evaluate(ResponsePayload.text("<a>1</a><b>9</b>"), grader);

        assertThat(result.getScore()).isEqualTo(2.0);
        assertThat(result.getMaxScore()).isEqualTo(5.0);
        assertThat(result.isPassed()).isFalse();
        assertThat(result.getError()).isNull();
        assertThat(result.getFailedFields()).extracting(FieldResult::getKey).containsExactly("b");
    }

    @Test
    void shouldReportEveryFieldInDeclarationOrder() throws Exception {
        GraderConfig grader =
                xml(
                        "answers",
                        field("z", FieldType.STRING, 1.0, "last"),
                        field("a", FieldType.INT, 1.0, 1),
                        field("m", FieldType.BOOLEAN, 1.0, true));

        GraderResult result = evaluator.evaluate(ResponsePayload.text("<a>x</a>"), grader);

        assertThat(result.getDetails()).extracting(FieldResult::getKey).containsExactly("z", "a", "m");
        assertThat(result.getDetails().get(0).getFailure().kind())
                .isEqualTo(FailureKind.MISSING_FIELD);
        assertThat(result.getDetails().get(1).getFailure().kind())
                .isEqualTo(FailureKind.COERCION_FAILED);
        assertThat(result.getDetails().get(1).getRawValue()).isEqualTo("x");
    }

    @Test
    void shouldEchoExpectationAndActualValue() throws Exception {
        GraderResult result =
                evaluator.evaluate(
                        ResponsePayload.text("<x>5</x>"), xml("g", field("x", FieldType.INT, 1.0, "5")));

        FieldResult detail = result.getDetails().get(0);
        assertThat(detail.getExpected()).isEqualTo("5");
        assertThat(detail.getActual()).isEqualTo(5L);
        assertThat(detail.getFieldId()).isEqualTo("x_id");
        assertThat(detail.getComparatorType()).isEqualTo(ComparatorType.EQUALS);
        assertThat(detail.isPassed()).isTrue();
    }

    @Test
    void shouldExcludeInapplicableFieldsFromScore() throws Exception {
        GraderConfig grader =
                xml(
                        "answers",
                        field("a", FieldType.INT, 1.0, 1),
                        field("b", FieldType.INT, 4.0, null));

        GraderResult result = evaluator.evaluate(ResponsePayload.text("<a>1</a><b>2</b>"), grader);

        assertThat(result.getScore()).isEqualTo(1.0);
        assertThat(result.getMaxScore()).isEqualTo(1.0);
        assertThat(result.isPassed()).isTrue();
        FieldResult skipped = result.getDetails().get(1);
        assertThat(skipped.isApplicable()).isFalse();
        assertThat(skipped.isPassed()).isFalse();
        assertThat(skipped.getActual()).isEqualTo(2L);
    }

    @Test
    void shouldPassVacuouslyWithNoApplicableFields() throws Exception {
        GraderConfig grader = xml("template", field("a", FieldType.INT, 1.0, null));

        GraderResult result = evaluator.evaluate(ResponsePayload.text(""), grader);

        assertThat(result.getScore()).isZero();
        assertThat(result.getMaxScore()).isZero();
        assertThat(result.isPassed()).isTrue();
        assertThat(result.getContribution()).isZero();
    }

    @Test
    void shouldRecordInvalidJsonAsGraderError() throws Exception {
        when(codec.readObject(anyString())).thenThrow(new JsonCodecException("Unexpected token"));
        GraderConfig grader =
                grader(
                        GraderType.JSON,
                        "json",
                        1.0,
                        field("a", FieldType.STRING, 1.0, "x"),
                        field("b", FieldType.STRING, 1.0, "y"));

        GraderResult result = evaluator.evaluate(ResponsePayload.text("{oops"), grader);

        assertThat(result.getError()).contains("Unexpected token");
        assertThat(result.getScore()).isZero();
        assertThat(result.getMaxScore()).isEqualTo(2.0);
        assertThat(result.getDetails())
                .allSatisfy(
                        detail ->
                                assertThat(detail.getFailure().kind())
                                        .isEqualTo(FailureKind.INVALID_CONTAINER));
    }

    @Test
    void shouldReadJsonMembers() throws Exception {
        when(codec.readObject(anyString())).thenReturn(Map.of("answer", 42, "unit", "m"));
        GraderConfig grader =
                grader(
                        GraderType.JSON,
                        "json",
                        1.0,
                        field("answer", FieldType.INT, 1.0, 42),
                        field(
                                "unit",
                                FieldType.STRING,
                                new ComparatorConfig(
                                        ComparatorType.IN_LIST, Map.of("allowed_values", List.of("m", "km")))));

        GraderResult result =
                evaluator.evaluate(ResponsePayload.text("{\"answer\":42,\"unit\":\"m\"}"), grader);

        assertThat(result.getScore()).isEqualTo(2.0);
        assertThat(result.isPassed()).isTrue();
    }

    @Test
    void shouldRejectGraderWithoutFields() {
        GraderConfig empty = xml("empty");

        assertThatThrownBy(() -> evaluator.evaluate(ResponsePayload.text("<a>1</a>"), empty))
                .isInstanceOf(GraderConfigurationException.class)
                .hasMessageContaining("declares no fields");
    }

    @Test
    void shouldRejectComparatorTypeWithoutImplementation() {
        GraderEvaluator bare =
                new GraderEvaluator(new DefaultComparatorRegistry(List.of()), codec, new GradingConfig());

        assertThatThrownBy(
                        () ->
                                bare.evaluate(
                                        ResponsePayload.text("<a>1</a>"),
                                        xml("g", field("a", FieldType.INT, 1.0, 1))))
                .isInstanceOf(GraderConfigurationException.class)
                .hasMessageContaining("equals");
    }
}
