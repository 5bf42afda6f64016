package io.gradekit.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.gradekit.core.GradingConfig;
import io.gradekit.core.grader.GraderConfigurationException;
import io.gradekit.core.grader.model.ComparatorType;
import io.gradekit.core.grader.model.FieldLayout;
import io.gradekit.core.grader.model.FieldType;
import io.gradekit.core.grader.model.GraderConfig;
import io.gradekit.core.grader.model.GraderField;
import io.gradekit.core.grader.model.GraderType;
import io.gradekit.core.task.TaskDefinition;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("GraderConfigReader")
class GraderConfigReaderTest {

    private final GraderConfigReader reader = new GraderConfigReader();

    @Nested
    class StructureGraders {

        @Test
        void shouldReadStructureFieldsInOrder() throws Exception {
            List<GraderConfig> graders =
                    reader.readGraders(
                            """
                            [{
                              "type": "xml", "name": "Report", "weight": 2,
                              "config": {
                                "structure": [
                                  {"id": "f1", "name": "revenue", "type": "int", "weight": 3,
                                   "comparator": {"type": "equals", "config": {"expected": 1200}}},
                                  {"id": "f2", "name": "approved", "type": "bool",
                                   "comparator": {"type": "equals", "config": {"expected": true}}}
                                ],
                                "binary_mode": false
                              }
                            }]
                            """);

            assertThat(graders).hasSize(1);
            GraderConfig grader = graders.get(0);
            assertThat(grader.getType()).isEqualTo(GraderType.XML);
            assertThat(grader.getName()).isEqualTo("Report");
            assertThat(grader.getWeight()).isEqualTo(2.0);
            assertThat(grader.getLayout()).isEqualTo(FieldLayout.STRUCTURE);
            assertThat(grader.getSettings()).containsEntry("binary_mode", false);

            GraderField revenue = grader.getFields().get(0);
            assertThat(revenue.getId()).isEqualTo("f1");
            assertThat(revenue.getKey()).isEqualTo("revenue");
            assertThat(revenue.getType()).isEqualTo(FieldType.INT);
            assertThat(revenue.getWeight()).isEqualTo(3.0);
            assertThat(revenue.getComparator().type()).isEqualTo(ComparatorType.EQUALS);
            assertThat(revenue.getComparator().getExpected()).isEqualTo(1200L);

            GraderField approved = grader.getFields().get(1);
            assertThat(approved.getType()).isEqualTo(FieldType.BOOLEAN);
            assertThat(approved.getWeight()).isEqualTo(1.0);
        }

        @Test
        void shouldKeepUnrecognisedFieldPropertiesAsAttributes() throws Exception {
            GraderConfig grader =
                    reader.readGraders(
                                    """
                                    {"type": "json", "config": {"structure": [
                                      {"name": "a", "children": [], "isExpanded": true,
                                       "comparator": {"type": "regex", "config": {"pattern": "^a"}}}
                                    ]}}
                                    """)
                            .get(0);

            GraderField field = grader.getFields().get(0);
            assertThat(field.getAttributes())
                    .containsEntry("children", List.of())
                    .containsEntry("isExpanded", true);
            assertThat(field.getType()).isEqualTo(FieldType.STRING);
        }

        @Test
        void shouldDefaultNameToGraderType() throws Exception {
            GraderConfig grader =
                    reader.readGraders(
                                    """
                                    {"type": "json", "config": {"structure": [
                                      {"name": "a", "comparator": {"type": "equals"}}
                                    ]}}
                                    """)
                            .get(0);

            assertThat(grader.getName()).isEqualTo("json");
            assertThat(grader.getFields().get(0).getComparator().settings()).isEmpty();
        }

        @Test
        void shouldApplyConfiguredDefaultWeight() throws Exception {
            GraderConfigReader custom =
                    new GraderConfigReader(GradingConfig.builder().defaultGraderWeight(3).build());

            GraderConfig grader =
                    custom.readGraders(
                                    """
                                    {"type": "xml", "config": {"structure": [
                                      {"name": "a", "comparator": {"type": "equals"}}
                                    ]}}
                                    """)
                            .get(0);

            assertThat(grader.getWeight()).isEqualTo(3.0);
        }

        @Test
        void shouldAcceptNumericWeightText() throws Exception {
            GraderConfig grader =
                    reader.readGraders(
                                    """
                                    {"type": "xml", "weight": "2.5", "config": {"structure": [
                                      {"name": "a", "comparator": {"type": "equals"}}
                                    ]}}
                                    """)
                            .get(0);

            assertThat(grader.getWeight()).isEqualTo(2.5);
        }
    }

    @Nested
    class TestCaseGraders {

        @Test
        void shouldKeyTestCasesById() throws Exception {
            GraderConfig grader =
                    reader.readGraders(
                                    """
                                    {"type": "unit_test", "config": {"test_cases": [
                                      {"id": "t1", "expected_value": 42},
                                      {"id": 7, "expected_value": "seven", "weight": 2}
                                    ]}}
                                    """)
                            .get(0);

            assertThat(grader.getLayout()).isEqualTo(FieldLayout.TEST_CASES);
            assertThat(grader.getFields())
                    .extracting(GraderField::getKey)
                    .containsExactly("t1", "7");
            assertThat(grader.getFields().get(0).getComparator().getExpected()).isEqualTo(42L);
            assertThat(grader.getFields().get(0).getType()).isEqualTo(FieldType.STRING);
            assertThat(grader.getFields().get(1).getWeight()).isEqualTo(2.0);
            assertThat(grader.getFields().get(0).getDefaultedKeys())
                    .containsExactlyInAnyOrder("type", "weight");
            assertThat(grader.getFields().get(1).getDefaultedKeys()).containsExactly("type");
        }

        @Test
        void shouldCompareCustomComparatorAgainstExpectedValue() throws Exception {
            GraderConfig grader =
                    reader.readGraders(
                                    """
                                    {"type": "unit_test", "config": {"test_cases": [
                                      {"id": "t1", "expected_value": "ok",
                                       "comparator": {"type": "contains", "config": {}}}
                                    ]}}
                                    """)
                            .get(0);

            GraderField field = grader.getFields().get(0);
            assertThat(field.getComparator().type()).isEqualTo(ComparatorType.CONTAINS);
            assertThat(field.getComparator().getExpected()).isEqualTo("ok");
            assertThat(field.getAttributes()).doesNotContainKey(GraderField.EXPECTED_VALUE);
        }

        @Test
        void shouldKeepExplicitComparatorExpectation() throws Exception {
            GraderConfig grader =
                    reader.readGraders(
                                    """
                                    {"type": "unit_test", "config": {"test_cases": [
                                      {"id": "t1", "expected_value": 10, "type": "float",
                                       "comparator": {"type": "tolerance",
                                                      "config": {"expected": 9.5, "tolerance": 1}}}
                                    ]}}
                                    """)
                            .get(0);

            GraderField field = grader.getFields().get(0);
            assertThat(field.getComparator().getExpected()).isEqualTo(9.5);
            assertThat(field.getAttributes()).containsEntry(GraderField.EXPECTED_VALUE, 10L);
        }
    }

    @Nested
    class WholeResponseGraders {

        @ParameterizedTest
        @CsvSource({"text, STRING", "number, FLOAT"})
        void shouldTranslateExpectedIntoImplicitField(String type, FieldType fieldType)
                throws Exception {
            GraderConfig grader =
                    reader.readGraders(
                                    "{\"type\": \""
                                            + type
                                            + "\", \"config\": {\"expected\": \"42\"}}")
                            .get(0);

            assertThat(grader.getLayout()).isEqualTo(FieldLayout.WHOLE_RESPONSE);
            assertThat(grader.getFields()).hasSize(1);
            GraderField field = grader.getFields().get(0);
            assertThat(field.getKey()).isEqualTo("response");
            assertThat(field.getType()).isEqualTo(fieldType);
            assertThat(field.getComparator().getExpected()).isEqualTo("42");
            assertThat(grader.getSettings()).isEmpty();
        }

        @Test
        void shouldLoadTextGraderWithoutExpectationAsEmpty() throws Exception {
            GraderConfig grader = reader.readGraders("{\"type\": \"text\", \"config\": {}}").get(0);

            assertThat(grader.getFields()).isEmpty();
        }
    }

    @Nested
    class Documents {

        @Test
        void shouldReadGradersOfSingleTaskDocument() throws Exception {
            List<GraderConfig> graders =
                    reader.readGraders(Fixtures.load(Fixtures.QUARTERLY_REPORT));

            assertThat(graders)
                    .extracting(GraderConfig::getName)
                    .containsExactly("Report fields", "Checks");
        }

        @Test
        void shouldReadTasks() throws Exception {
            List<TaskDefinition> tasks = reader.readTasks(Fixtures.load(Fixtures.QUARTERLY_REPORT));

            assertThat(tasks).hasSize(1);
            TaskDefinition task = tasks.get(0);
            assertThat(task.name()).isEqualTo("Quarterly report");
            assertThat(task.description()).isEqualTo("Extract the headline figures");
            assertThat(task.prompt()).startsWith("Read the attached report");
            assertThat(task.graders()).hasSize(2);
        }

        @Test
        void shouldRejectMultiTaskDocumentWhenReadingGraders() {
            String json =
                    """
                    {"tasks": [
                      {"name": "a", "graders": []},
                      {"name": "b", "graders": []}
                    ]}
                    """;

            assertThatThrownBy(() -> reader.readGraders(json))
                    .isInstanceOf(GraderConfigurationException.class)
                    .hasMessageContaining("exactly one task")
                    .extracting(e -> ((GraderConfigurationException) e).getPath())
                    .isEqualTo("$.tasks");
        }
    }

    @Nested
    class ConfigurationErrors {

        @ParameterizedTest(name = "{0}")
        @CsvSource(
                delimiter = '|',
                textBlock =
                        """
                        unknown grader type    | [{"type": "yaml", "config": {}}]   | graders[0].type
                        missing grader type    | [{"config": {}}]                   | graders[0].type
                        no field list          | [{"type": "xml", "config": {}}]    | graders[0].config
                        config not an object   | [{"type": "xml", "config": []}]    | graders[0].config
                        negative grader weight | [{"type": "text", "weight": -1}]   | graders[0].weight
                        weight not a number    | [{"type": "text", "weight": true}] | graders[0].weight
                        not json               | [{                                 | $
                        scalar document        | 42                                 | $
                        """)
        void shouldReportPathOfInvalidGrader(String description, String json, String path) {
            assertThatThrownBy(() -> reader.readGraders(json))
                    .isInstanceOf(GraderConfigurationException.class)
                    .extracting(e -> ((GraderConfigurationException) e).getPath())
                    .isEqualTo(path);
        }

        @Test
        void shouldRejectBothFieldLists() {
            String json =
                    """
                    {"type": "xml", "config": {"structure": [], "test_cases": []}}
                    """;

            assertThatThrownBy(() -> reader.readGraders(json))
                    .isInstanceOf(GraderConfigurationException.class)
                    .hasMessage("grader.config: Grader declares both structure and test_cases");
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource(
                delimiter = '|',
                textBlock =
                        """
                        unknown field type    | {"name": "a", "type": "date", "comparator": {"type": "equals"}} | .type
                        negative field weight | {"name": "a", "weight": -2, "comparator": {"type": "equals"}}  | .weight
                        missing comparator    | {"name": "a"}                                                   | .comparator
                        unknown comparator    | {"name": "a", "comparator": {"type": "fuzzy"}}                  | .comparator.type
                        comparator not object | {"name": "a", "comparator": "equals"}                           | .comparator
                        field without key     | {"comparator": {"type": "equals"}}                              | ''
                        """)
        void shouldReportPathOfInvalidStructureField(
                String description, String field, String suffix) {
            String json = "[{\"type\": \"xml\", \"config\": {\"structure\": [" + field + "]}}]";

            assertThatThrownBy(() -> reader.readGraders(json))
                    .isInstanceOf(GraderConfigurationException.class)
                    .extracting(e -> ((GraderConfigurationException) e).getPath())
                    .isEqualTo("graders[0].config.structure[0]" + suffix);
        }

        @Test
        void shouldReportPathOfTestCaseWithoutId() {
            String json =
                    """
                    [{"type": "unit_test", "config": {"test_cases": [{"expected_value": 1}]}}]
                    """;

            assertThatThrownBy(() -> reader.readGraders(json))
                    .isInstanceOf(GraderConfigurationException.class)
                    .extracting(e -> ((GraderConfigurationException) e).getPath())
                    .isEqualTo("graders[0].config.test_cases[0].id");
        }
    }
}
