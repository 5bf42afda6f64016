package io.gradekit.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gradekit.core.grader.GraderConfigurationException;
import io.gradekit.core.grader.GraderExports;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.GraderConfig;
import io.gradekit.core.grader.model.GraderField;
import io.gradekit.core.response.ResponsePayload;
import io.gradekit.core.response.ResponsePayload.FormResponse;
import io.gradekit.core.task.TaskDefinition;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GraderConfigWriter")
class GraderConfigWriterTest {

    private final GraderConfigReader reader = new GraderConfigReader();
    private final GraderConfigWriter writer = new GraderConfigWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    private List<TaskDefinition> tasks;

    @BeforeEach
    void setUp() throws Exception {
        tasks = reader.readTasks(Fixtures.load(Fixtures.QUARTERLY_REPORT));
    }

    @Test
    void roundTrip_taskDocument() throws Exception {
        String json = writer.writeTasks(tasks);
        List<TaskDefinition> restored = reader.readTasks(json);

        assertThat(restored).usingRecursiveComparison().isEqualTo(tasks);
    }

    @Test
    void roundTrip_graderArray() throws Exception {
        List<GraderConfig> graders = tasks.get(0).graders();

        List<GraderConfig> restored = reader.readGraders(writer.writeGraders(graders));

        assertThat(restored).usingRecursiveComparison().isEqualTo(graders);
    }

    @Test
    void roundTrip_wholeResponseGrader() throws Exception {
        List<GraderConfig> graders =
                reader.readGraders(
                        """
                        {"type": "number", "weight": 0.5, "config": {"expected": 3.14}}
                        """);

        JsonNode written = mapper.readTree(writer.writeGraders(graders)).get(0);

        assertThat(written.path("config").path("expected").doubleValue()).isEqualTo(3.14);
        assertThat(written.path("config").has("structure")).isFalse();
        assertThat(written.path("weight").doubleValue()).isEqualTo(0.5);
        assertThat(reader.readGraders(writer.writeGraders(graders)))
                .usingRecursiveComparison()
                .isEqualTo(graders);
    }

    @Nested
    class CanonicalShape {

        private JsonNode grader(int index) throws Exception {
            return mapper.readTree(writer.writeTasks(tasks))
                    .path("tasks")
                    .get(0)
                    .path("graders")
                    .get(index);
        }

        @Test
        void shouldWriteStructureFieldsWithInterpretedKeysFirst() throws Exception {
            JsonNode field = grader(0).path("config").path("structure").get(0);

            assertThat(fieldNames(field))
                    .containsExactly(
                            "id", "name", "type", "weight", "comparator", "children", "isExpanded");
            assertThat(field.path("weight").isIntegralNumber()).isTrue();
        }

        @Test
        void shouldWriteSettingsAfterFieldList() throws Exception {
            assertThat(fieldNames(grader(0).path("config")))
                    .containsExactly("structure", "binary_mode");
        }

        @Test
        void shouldOmitComparatorOfPlainTestCase() throws Exception {
            JsonNode cases = grader(1).path("config").path("test_cases");

            assertThat(cases.get(0).has("comparator")).isFalse();
            assertThat(cases.get(0).path("expected_value").asInt()).isEqualTo(42);
            assertThat(cases.get(1).path("comparator").path("type").asText())
                    .isEqualTo("contains");
        }

        @Test
        void shouldWriteTaskMetadata() throws Exception {
            JsonNode task = mapper.readTree(writer.writeTasks(tasks)).path("tasks").get(0);

            assertThat(task.path("name").asText()).isEqualTo("Quarterly report");
            assertThat(task.path("prompt").asText()).startsWith("Read the attached report");
            assertThat(task.path("graders").size()).isEqualTo(2);
        }
    }

    @Nested
    class TestCaseExpectations {

        private static final String TOLERANCE_CASE =
                """
                {"type": "unit_test", "config": {"test_cases": [
                  {"id": "q1", "type": "float", "expected_value": 10,
                   "comparator": {"type": "tolerance", "config": {"expected": 9.5, "tolerance": 1}}}
                ]}}
                """;

        @Test
        void shouldKeepDeclaredExpectedValueBesideComparatorExpectation() throws Exception {
            List<GraderConfig> graders = reader.readGraders(TOLERANCE_CASE);

            JsonNode testCase =
                    mapper.readTree(writer.writeGraders(graders))
                            .get(0)
                            .path("config")
                            .path("test_cases")
                            .get(0);

            assertThat(fieldNames(testCase))
                    .containsExactly("id", "type", "expected_value", "comparator");
            assertThat(testCase.path("expected_value").asInt()).isEqualTo(10);
            assertThat(testCase.path("comparator").path("config").path("expected").doubleValue())
                    .isEqualTo(9.5);
            assertThat(reader.readGraders(writer.writeGraders(graders)))
                    .usingRecursiveComparison()
                    .isEqualTo(graders);
        }

        @Test
        void shouldKeepEqualsComparatorWithItsOwnExpectation() throws Exception {
            List<GraderConfig> graders =
                    reader.readGraders(
                            """
                            {"type": "unit_test", "config": {"test_cases": [
                              {"id": "q1", "expected_value": "a",
                               "comparator": {"type": "equals", "config": {"expected": "b"}}}
                            ]}}
                            """);

            JsonNode testCase =
                    mapper.readTree(writer.writeGraders(graders))
                            .get(0)
                            .path("config")
                            .path("test_cases")
                            .get(0);

            assertThat(testCase.path("expected_value").asText()).isEqualTo("a");
            assertThat(testCase.path("comparator").path("config").path("expected").asText())
                    .isEqualTo("b");
        }

        @Test
        void shouldNotAddDefaultedTypeAndWeight() throws Exception {
            JsonNode cases =
                    mapper.readTree(writer.writeTasks(tasks))
                            .path("tasks")
                            .get(0)
                            .path("graders")
                            .get(1)
                            .path("config")
                            .path("test_cases");

            assertThat(fieldNames(cases.get(0))).containsExactly("id", "expected_value");
            assertThat(fieldNames(cases.get(1)))
                    .containsExactly("id", "type", "weight", "expected_value", "comparator");
        }

        @Test
        void shouldWriteDefaultedKeyOnceItNoLongerHoldsTheDefault() throws Exception {
            GraderConfig grader =
                    reader.readGraders(
                                    """
                                    {"type": "unit_test", "config": {"test_cases": [
                                      {"id": "t1", "expected_value": 1}
                                    ]}}
                                    """)
                            .get(0);
            GraderField reweighted = grader.getFields().get(0).toBuilder().weight(3).build();
            GraderConfig changed = grader.withFields(List.of(reweighted));

            JsonNode testCase =
                    mapper.readTree(writer.writeGraders(List.of(changed)))
                            .get(0)
                            .path("config")
                            .path("test_cases")
                            .get(0);

            assertThat(fieldNames(testCase)).containsExactly("id", "weight", "expected_value");
        }

        @Test
        void shouldStripAndPopulateDeclaredExpectedValue() throws Exception {
            List<GraderConfig> graders = reader.readGraders(TOLERANCE_CASE);

            JsonNode template =
                    mapper.readTree(writer.writeGraders(GraderExports.strip(graders)))
                            .get(0)
                            .path("config")
                            .path("test_cases")
                            .get(0);
            JsonNode answerKey =
                    mapper.readTree(
                                    writer.writeGraders(
                                            GraderExports.populate(
                                                    graders,
                                                    ResponsePayload.form(Map.of("q1", "11")))))
                            .get(0)
                            .path("config")
                            .path("test_cases")
                            .get(0);

            assertThat(template.get("expected_value").isNull()).isTrue();
            assertThat(template.path("comparator").path("config").get("expected").isNull())
                    .isTrue();
            assertThat(answerKey.path("expected_value").asInt()).isEqualTo(11);
            assertThat(answerKey.path("comparator").path("config").path("expected").asInt())
                    .isEqualTo(11);
        }
    }

    @Nested
    class Exports {

        @Test
        void shouldClearEveryExpectationAndKeepEverythingElse() throws Exception {
            List<GraderConfig> graders = tasks.get(0).graders();

            String json = writer.writeGraders(GraderExports.strip(graders));
            JsonNode root = mapper.readTree(json);

            for (JsonNode field : root.get(0).path("config").path("structure")) {
                assertThat(field.path("comparator").path("config").get("expected").isNull())
                        .isTrue();
            }
            for (JsonNode testCase : root.get(1).path("config").path("test_cases")) {
                assertThat(testCase.get("expected_value").isNull()).isTrue();
            }
            JsonNode inList = root.get(0).path("config").path("structure").get(2);
            assertThat(inList.path("comparator").path("config").path("allowed_values").size())
                    .isEqualTo(2);
        }

        @Test
        void shouldReimportStrippedTemplateWithSameStructure() throws Exception {
            List<GraderConfig> graders = tasks.get(0).graders();

            List<GraderConfig> restored =
                    reader.readGraders(writer.writeGraders(GraderExports.strip(graders)));

            assertThat(restored)
                    .usingRecursiveComparison()
                    .ignoringFields("fields.comparator")
                    .isEqualTo(graders);
            assertThat(restored)
                    .flatExtracting(GraderConfig::getFields)
                    .extracting(GraderField::getComparator)
                    .extracting(ComparatorConfig::getExpected)
                    .containsOnlyNulls();
        }

        @Test
        void shouldWritePopulatedAnswerKey() throws Exception {
            List<GraderConfig> template = GraderExports.strip(tasks.get(0).graders());
            FormResponse form =
                    ResponsePayload.form(Map.of("revenue", "1300", "margin", "11.75", "t1", "43"));

            JsonNode root =
                    mapper.readTree(writer.writeGraders(GraderExports.populate(template, form)));

            JsonNode structure = root.get(0).path("config").path("structure");
            assertThat(structure.get(0).path("comparator").path("config").path("expected").asLong())
                    .isEqualTo(1300L);
            assertThat(
                            structure
                                    .get(1)
                                    .path("comparator")
                                    .path("config")
                                    .path("expected")
                                    .doubleValue())
                    .isEqualTo(11.75);
            assertThat(structure.get(2).path("comparator").path("config").get("expected").isNull())
                    .isTrue();
            JsonNode firstCase = root.get(1).path("config").path("test_cases").get(0);
            assertThat(firstCase.path("expected_value").isNumber()).isTrue();
            assertThat(firstCase.path("expected_value").asInt()).isEqualTo(43);
        }
    }

    @Nested
    class JacksonBinding {

        private final ObjectMapper gradeKitMapper = GradeKitSerializer.createMapper();

        @Test
        void shouldDeserializeGraderThroughObjectMapper() throws Exception {
            GraderConfig grader =
                    gradeKitMapper.readValue(
                            "{\"type\": \"text\", \"config\": {\"expected\": \"yes\"}}",
                            GraderConfig.class);

            assertThat(grader.getFields()).hasSize(1);
            assertThat(grader.getFields().get(0).getComparator().getExpected()).isEqualTo("yes");
        }

        @Test
        void shouldWrapConfigurationErrorInMappingException() {
            assertThatThrownBy(
                            () ->
                                    gradeKitMapper.readValue(
                                            "{\"type\": \"csv\"}", GraderConfig.class))
                    .isInstanceOf(JsonMappingException.class)
                    .hasCauseInstanceOf(GraderConfigurationException.class)
                    .hasMessageContaining("Unknown grader type: csv");
        }

        @Test
        void shouldDeserializeTaskDefinition() throws Exception {
            String task =
                    mapper.readTree(Fixtures.load(Fixtures.QUARTERLY_REPORT))
                            .path("tasks")
                            .get(0)
                            .toString();

            TaskDefinition definition = gradeKitMapper.readValue(task, TaskDefinition.class);

            assertThat(definition).usingRecursiveComparison().isEqualTo(tasks.get(0));
        }
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
