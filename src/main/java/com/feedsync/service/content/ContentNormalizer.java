package com.feedsync.service.content;

import com.feedsync.config.SyncProperties;
import com.feedsync.model.Account;
import com.feedsync.service.feed.FeedItem;
import lombok.RequiredArgsConstructor;
import org.apache.commons.text.StringEscapeUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic mapping from an upstream item to the fields stored on an article.
 */
@Service
@RequiredArgsConstructor
public class ContentNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CJK_IDEOGRAPH = Pattern.compile("\\p{IsHan}");
    private static final String UNKNOWN_AUTHOR = "unknown";
    private static final Set<String> BLOCK_TAGS = Set.of(
            "p", "div", "li", "h1", "h2", "h3", "h4", "h5", "h6", "blockquote", "section", "br");

    private final SyncProperties properties;

    public NormalizedArticle normalize(FeedItem item, Account account) {
        String html = item.getHtmlBody() != null ? item.getHtmlBody() : "";
        Document document = Jsoup.parseBodyFragment(html);
        List<String> images = extractImages(document);
        String text = toPlainText(document);
        int wordCount = countWords(text);

        String cover = isBlank(item.getCoverImageUrl())
                ? (images.isEmpty() ? null : images.get(0))
                : item.getCoverImageUrl().trim();

        return NormalizedArticle.builder()
                .guid(item.getGuid())
                .title(cleanText(item.getTitle()))
                .author(resolveAuthor(item.getAuthor(), account))
                .url(item.getLink())
                .contentHtml(item.getHtmlBody())
                .content(text)
                .summary(summarize(item.getSummary(), text))
                .imageUrls(images)
                .coverImage(cover)
                .publishedAt(item.getPublishedAt())
                .wordCount(wordCount)
                .readingTimeMinutes(readingTime(wordCount))
                .build();
    }

    String toPlainText(Document document) {
        document.select("script, style, iframe, noscript").remove();
        StringBuilder raw = new StringBuilder();
        // text nodes come back whitespace-normalised, so the only newlines are block boundaries
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    raw.append(((TextNode) node).text());
                } else if (isBlock(node)) {
                    raw.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (isBlock(node)) {
                    raw.append('\n');
                }
            }
        }, document.body());

        List<String> lines = new ArrayList<>();
        for (String line : raw.toString().split("\n")) {
            String cleaned = WHITESPACE.matcher(line).replaceAll(" ").trim();
            if (!cleaned.isEmpty()) {
                lines.add(cleaned);
            }
        }
        return String.join("\n", lines);
    }

    private static boolean isBlock(Node node) {
        return node instanceof Element && BLOCK_TAGS.contains(((Element) node).normalName());
    }

    List<String> extractImages(Document document) {
        Set<String> urls = new LinkedHashSet<>();
        Elements images = document.select("img");
        for (Element img : images) {
            String src = img.hasAttr("src") && !img.attr("src").isBlank() ? img.attr("src") : img.attr("data-src");
            if (src != null && src.startsWith("http")) {
                urls.add(src.trim());
            }
        }
        return List.copyOf(urls);
    }

    String summarize(String upstreamSummary, String text) {
        if (!isBlank(upstreamSummary)) {
            return cleanText(Jsoup.parseBodyFragment(upstreamSummary).text());
        }
        if (text.isEmpty()) {
            return "";
        }
        int maxLength = properties.getContent().getSummaryLength();
        String flat = WHITESPACE.matcher(text).replaceAll(" ");
        if (flat.length() <= maxLength) {
            return flat;
        }
        int cut = Character.isHighSurrogate(flat.charAt(maxLength - 1)) ? maxLength - 1 : maxLength;
        String summary = flat.substring(0, cut);
        int sentenceEnd = Math.max(summary.lastIndexOf('。'), summary.lastIndexOf(". "));
        if (sentenceEnd > maxLength / 2) {
            return summary.substring(0, sentenceEnd + 1);
        }
        return summary + "...";
    }

    /**
     * Whitespace-delimited tokens, except that each CJK ideograph counts as one word.
     */
    int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        Matcher han = CJK_IDEOGRAPH.matcher(text);
        int ideographs = 0;
        while (han.find()) {
            ideographs++;
        }
        String withoutHan = CJK_IDEOGRAPH.matcher(text).replaceAll(" ").trim();
        int tokens = withoutHan.isEmpty() ? 0 : WHITESPACE.split(withoutHan).length;
        return ideographs + tokens;
    }

    int readingTime(int wordCount) {
        int wordsPerMinute = properties.getContent().getWordsPerMinute();
        return Math.max(1, (wordCount + wordsPerMinute - 1) / wordsPerMinute);
    }

    private String resolveAuthor(String author, Account account) {
        String cleaned = cleanText(author);
        if (cleaned.isEmpty() || UNKNOWN_AUTHOR.equalsIgnoreCase(cleaned)) {
            return account.getName();
        }
        return cleaned;
    }

    private String cleanText(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(StringEscapeUtils.unescapeHtml4(text)).replaceAll(" ").trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
