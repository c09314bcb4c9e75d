package org.springaicommunity.commitwatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link MarkdownRenderer}.
 */
@DisplayName("MarkdownRenderer Tests")
class MarkdownRendererTest {

	private final MarkdownRenderer renderer = new MarkdownRenderer();

	@ParameterizedTest
	@ValueSource(strings = { "<html><body>Done</body></html>", "<BODY class=\"x\">Done</BODY>",
			"intro\n<head>\n<title>t</title></head>" })
	@DisplayName("Should pass HTML documents through unchanged")
	void shouldPassThroughHtml(String html) {
		assertThat(renderer.isHtmlDocument(html)).isTrue();
		assertThat(renderer.toHtml(html)).isEqualTo(html);
	}

	@Test
	@DisplayName("Should not mistake similar tags for a document")
	void shouldNotMatchSimilarTags() {
		assertThat(renderer.isHtmlDocument("<header>x</header> and <bodyguard>")).isFalse();
	}

	@Test
	@DisplayName("Should render markdown tables")
	void shouldRenderTables() {
		String html = renderer.toHtml("| Feature | Risk |\n|---|---|\n| Login | High |\n");

		assertThat(html).contains("<table>").contains("<th>Feature</th>").contains("<td>High</td>");
	}

	@Test
	@DisplayName("Should render footnotes")
	void shouldRenderFootnotes() {
		String html = renderer.toHtml("New parser added[^1].\n\n[^1]: See commit abc123.\n");

		assertThat(html).contains("footnote").contains("See commit abc123.");
	}

	@Test
	@DisplayName("Should keep the language class on fenced code")
	void shouldRenderFencedCode() {
		String html = renderer.toHtml("```java\nString s = \"<x>\";\n```\n");

		assertThat(html).contains("<code class=\"language-java\">").contains("&lt;x&gt;");
	}

	@Test
	@DisplayName("Should render headings and emphasis")
	void shouldRenderBasicMarkdown() {
		assertThat(renderer.toHtml("# Summary\n\n**Risky** change")).contains("<h1>Summary</h1>")
			.contains("<strong>Risky</strong>");
	}

}
