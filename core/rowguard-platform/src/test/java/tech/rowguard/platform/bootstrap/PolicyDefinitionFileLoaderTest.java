package tech.rowguard.platform.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.rowguard.platform.policy.FilterType;
import tech.rowguard.platform.reconcile.PolicyDefinitionException;
import tech.rowguard.platform.reconcile.PolicyDescriptor;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PolicyDefinitionFileLoaderTest {

    @TempDir
    Path tempDir;

    private PolicyDefinitionFileLoader loader;

    @BeforeEach
    void setUp() {
        loader = new PolicyDefinitionFileLoader();
        loader.objectMapper = new ObjectMapper();
    }

    @Test
    @DisplayName("loads definitions in file order, defaulting the filter type to REGULAR")
    void load_shouldReadDefinitionsInOrder() throws URISyntaxException {
        Path file = Path.of(getClass().getResource("/policies/openedx-policies.json").toURI());

        List<PolicyDescriptor> descriptors = loader.load(file);

        assertThat(descriptors).containsExactly(
            new PolicyDescriptor("xapi", "xapi_events_all", "xapi_course_id",
                "{{can_view_courses(current_username(), \"splitByChar('/', course_id)[-1]\")}}",
                FilterType.REGULAR),
            new PolicyDescriptor("openedx", "Course Enrollments Overview", "enrollments_course_id",
                "{{can_view_courses(current_username(), \"course_key\")}}",
                FilterType.REGULAR)
        );
    }

    @Test
    @DisplayName("accepts base filters")
    void load_shouldParseBaseFilterType() throws IOException {
        Path file = write("""
            [{"schema": "s", "table": "t", "groupKey": "g", "clause": "1 = 1", "filterType": "BASE"}]
            """);

        assertThat(loader.load(file)).singleElement()
            .extracting(PolicyDescriptor::filterType)
            .isEqualTo(FilterType.BASE);
    }

    @Test
    @DisplayName("an empty array yields no definitions")
    void load_shouldAcceptEmptyArray() throws IOException {
        assertThat(loader.load(write("[]"))).isEmpty();
    }

    @Test
    @DisplayName("a missing file is a definition error")
    void load_shouldFail_whenFileMissing() {
        Path missing = tempDir.resolve("nope.json");

        assertThatThrownBy(() -> loader.load(missing))
            .isInstanceOf(PolicyDefinitionException.class)
            .hasMessageContaining("not found")
            .hasMessageContaining("nope.json");
    }

    @Test
    @DisplayName("malformed JSON is a definition error carrying the parse failure")
    void load_shouldFail_whenJsonMalformed() throws IOException {
        Path file = write("[{\"schema\": ");

        assertThatThrownBy(() -> loader.load(file))
            .isInstanceOf(PolicyDefinitionException.class)
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("an entry without a clause is rejected with its index")
    void load_shouldFail_whenEntryIncomplete() throws IOException {
        Path file = write("""
            [
              {"schema": "s", "table": "t", "groupKey": "g", "clause": "1 = 1"},
              {"schema": "s", "table": "t", "groupKey": "g2"}
            ]
            """);

        assertThatThrownBy(() -> loader.load(file))
            .isInstanceOf(PolicyDefinitionException.class)
            .hasMessageContaining("Entry #1")
            .hasMessageContaining("clause is required");
    }

    @Test
    @DisplayName("an unknown filter type is rejected")
    void load_shouldFail_whenFilterTypeUnknown() throws IOException {
        Path file = write("""
            [{"schema": "s", "table": "t", "groupKey": "g", "clause": "c", "filterType": "Permissive"}]
            """);

        assertThatThrownBy(() -> loader.load(file))
            .isInstanceOf(PolicyDefinitionException.class)
            .hasMessageContaining("Unknown filter type: Permissive");
    }

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("policies.json");
        Files.writeString(file, json);
        return file;
    }
}
