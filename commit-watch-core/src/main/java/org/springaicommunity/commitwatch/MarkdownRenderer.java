package org.springaicommunity.commitwatch;

import org.commonmark.Extension;
import org.commonmark.ext.footnotes.FootnotesExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Produces the HTML part of a notification.
 *
 * <p>
 * Text that already contains an {@code <html>}, {@code <head>} or {@code <body>} tag is
 * returned unchanged. Anything else is treated as markdown and rendered with table and
 * footnote support; fenced code blocks keep a {@code language-*} class for highlighting
 * in the mail client.
 */
public class MarkdownRenderer {

	private static final Pattern HTML_DOCUMENT_MARKER = Pattern.compile("<(html|head|body)[\\s>/]",
			Pattern.CASE_INSENSITIVE);

	private final Parser parser;

	private final HtmlRenderer renderer;

	public MarkdownRenderer() {
		List<Extension> extensions = List.of(TablesExtension.create(), FootnotesExtension.create());
		this.parser = Parser.builder().extensions(extensions).build();
		this.renderer = HtmlRenderer.builder().extensions(extensions).build();
	}

	/**
	 * Whether the text is already an HTML document.
	 * @param text text to inspect
	 * @return true if an html, head or body tag is present
	 */
	public boolean isHtmlDocument(String text) {
		return HTML_DOCUMENT_MARKER.matcher(text).find();
	}

	/**
	 * Convert the text to HTML unless it already is an HTML document.
	 * @param text markdown or HTML
	 * @return HTML
	 */
	public String toHtml(String text) {
		if (isHtmlDocument(text)) {
			return text;
		}
		return renderer.render(parser.parse(text));
	}

}
