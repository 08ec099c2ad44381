package com.williamcallahan.newsingest.service.extraction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Service;

/**
 * Extracts readable article text from saved web pages, dropping page chrome and scripts.
 */
@Service
public class HtmlContentExtractor {

    private static final int MAX_CONSECUTIVE_NEWLINES = 2;
    private static final String TEXT_BLOCKS = "h1, h2, h3, h4, h5, h6, p, li, blockquote, pre";
    private static final String NESTED_BLOCKS = "p, li, blockquote, pre";

    // Page chrome that never carries article text
    private static final String[] REMOVE_SELECTORS = {
        "script", "style", "noscript", "iframe", "svg",
        "nav", "header", "footer", "aside", "form",
        ".navigation", ".nav", ".navbar", ".sidebar", ".breadcrumb",
        ".advertisement", ".ad", ".cookie-banner", ".share", ".comments",
        "#navigation", "#nav", "#comments"
    };

    // Main content areas, in priority order
    private static final String[] CONTENT_SELECTORS = {
        "article", "main", "[itemprop=articleBody]", ".article-body", ".story-body",
        ".post-content", ".entry-content", "#content", ".content"
    };

    /**
     * Parses an HTML file and returns its article text.
     *
     * @param htmlPath Path to the HTML file
     * @return text with block elements separated by blank lines
     * @throws IOException if the file cannot be read
     */
    public String extractText(Path htmlPath) throws IOException {
        Document document = Jsoup.parse(htmlPath.toFile(), StandardCharsets.UTF_8.name());
        return extractCleanContent(document);
    }

    /**
     * Extracts article text from a parsed document.
     */
    public String extractCleanContent(Document document) {
        for (String selector : REMOVE_SELECTORS) {
            document.select(selector).remove();
        }
        Element content = findMainContent(document);
        if (content == null) {
            content = document.body();
        }
        if (content == null) {
            return "";
        }

        StringBuilder text = new StringBuilder();
        String title = document.title();
        if (title != null && !title.isBlank()) {
            text.append(title.trim()).append("\n\n");
        }
        Elements blocks = content.select(TEXT_BLOCKS);
        if (blocks.isEmpty()) {
            text.append(content.text());
        } else {
            for (Element block : blocks) {
                // Containers of other blocks are emitted through their inner blocks
                if (block.select(NESTED_BLOCKS).size() > 1) {
                    continue;
                }
                String blockText = block.text().trim();
                if (!blockText.isEmpty()) {
                    text.append(blockText).append("\n\n");
                }
            }
        }
        return collapseBlankLines(text.toString()).trim();
    }

    private Element findMainContent(Document document) {
        for (String selector : CONTENT_SELECTORS) {
            Elements elements = document.select(selector);
            if (!elements.isEmpty()) {
                return elements.stream()
                        .max((first, second) -> Integer.compare(first.text().length(), second.text().length()))
                        .orElse(elements.first());
            }
        }
        return null;
    }

    private static String collapseBlankLines(String text) {
        return text.replaceAll("\\n{" + (MAX_CONSECUTIVE_NEWLINES + 1) + ",}", "\n".repeat(MAX_CONSECUTIVE_NEWLINES));
    }
}
