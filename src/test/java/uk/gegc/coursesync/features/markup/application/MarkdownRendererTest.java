package uk.gegc.coursesync.features.markup.application;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.coursesync.BaseUnitTest;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MarkdownRenderer Tests")
class MarkdownRendererTest extends BaseUnitTest {

    private final MarkdownRenderer renderer = new MarkdownRenderer();

    @Test
    @DisplayName("render: sub-item indented by four spaces is nested")
    void render_fourSpaceSubItem_nestedList() {
        // When
        Document html = Jsoup.parseBodyFragment(renderer.render("- a\n    - b"));

        // Then
        assertThat(html.select("body > ul > li")).hasSize(1);
        assertThat(html.select("ul > li > ul > li").text()).isEqualTo("b");
    }

    @Test
    @DisplayName("render: sub-item indented by two spaces is a sibling")
    void render_twoSpaceSubItem_sibling() {
        // When
        Document html = Jsoup.parseBodyFragment(renderer.render("- a\n  - b"));

        // Then
        assertThat(html.select("ul ul")).isEmpty();
        assertThat(html.select("body > ul > li")).extracting(e -> e.text()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("render: ordered list with nested bullets")
    void render_orderedWithNestedBullets_mixedLists() {
        Document html = Jsoup.parseBodyFragment(renderer.render("1. first\n    - detail\n2. second"));

        assertThat(html.select("body > ol > li")).hasSize(2);
        assertThat(html.select("ol > li > ul > li").text()).isEqualTo("detail");
    }

    @Test
    @DisplayName("render: headings, emphasis and links")
    void render_inlineSpans_converted() {
        // When
        String html = renderer.render("# Title\n\nSome **bold** and *em* with [a link](https://example.com).");

        // Then
        assertThat(html).contains("<h1>Title</h1>");
        assertThat(html).contains("<strong>bold</strong>");
        assertThat(html).contains("<em>em</em>");
        assertThat(html).contains("<a href=\"https://example.com\">a link</a>");
    }

    @Test
    @DisplayName("render: fenced code keeps content escaped with its language")
    void render_fencedCode_escaped() {
        String html = renderer.render("```java\nif (a < b) {}\n```");

        assertThat(html).isEqualTo("<pre><code class=\"language-java\">if (a &lt; b) {}\n</code></pre>");
    }

    @Test
    @DisplayName("render: raw HTML block passes through unbalanced")
    void render_rawHtmlOpening_passesThrough() {
        String html = renderer.render("<div class=\"banner\">\n\nInside");

        assertThat(html).startsWith("<div class=\"banner\">");
        assertThat(html).contains("<p>Inside</p>");
        assertThat(html).doesNotContain("</div>");
    }

    @Test
    @DisplayName("render: pipe table with alignment")
    void render_pipeTable_table() {
        Document html = Jsoup.parseBodyFragment(renderer.render("| A | B |\n| :--- | ---: |\n| 1 | 2 |"));

        assertThat(html.select("th")).extracting(e -> e.text()).containsExactly("A", "B");
        assertThat(html.select("td").get(1).attr("style")).isEqualTo("text-align: right;");
    }

    @Test
    @DisplayName("render: blank input renders nothing")
    void render_blank_empty() {
        assertThat(renderer.render("  \n")).isEmpty();
        assertThat(renderer.render(null)).isEmpty();
    }
}
