package uk.gegc.coursesync.features.markup.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.coursesync.BaseUnitTest;
import uk.gegc.coursesync.features.markup.application.placeholder.SharedContent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PlaceholderExpander Tests")
class PlaceholderExpanderTest extends BaseUnitTest {

    private final PlaceholderExpander expander = new PlaceholderExpander();
    private final List<String> warnings = new ArrayList<>();

    private RenderContext context(SharedContent shared) {
        return new RenderContext(null, null, shared, shared, null, warnings::add);
    }

    @Test
    @DisplayName("expand: nested include and variable resolved")
    void expand_nestedIncludeAndVariable_resolved() {
        // Given
        SharedContent shared = new SharedContent(
                Map.of("footer", "Contact {{include:email}}", "email", "{{var:instructor}}@example.edu"),
                Map.of("instructor", "dr.lee"));

        // When
        String result = expander.expand("Bye. {{ include: footer }}", context(shared));

        // Then
        assertThat(result).isEqualTo("Bye. Contact dr.lee@example.edu");
        assertThat(warnings).isEmpty();
    }

    @Test
    @DisplayName("expand: unknown names stay and warn")
    void expand_unknownNames_keptWithWarning() {
        // When
        String result = expander.expand("{{include:nope}} {{var:missing}}", context(SharedContent.empty()));

        // Then
        assertThat(result).isEqualTo("{{include:nope}} {{var:missing}}");
        assertThat(warnings).containsExactly("Unknown include 'nope'", "Unknown variable 'missing'");
    }

    @Test
    @DisplayName("expand: self-including fragment stops at the depth limit")
    void expand_recursiveInclude_stopsWithWarning() {
        // Given
        SharedContent shared = new SharedContent(Map.of("loop", "x {{include:loop}}"), Map.of());

        // When
        String result = expander.expand("{{include:loop}}", context(shared));

        // Then
        assertThat(result).startsWith("x x x x x");
        assertThat(result).endsWith("{{include:loop}}");
        assertThat(warnings).singleElement().asString().contains("deeper than " + PlaceholderExpander.MAX_INCLUDE_DEPTH);
    }
}
