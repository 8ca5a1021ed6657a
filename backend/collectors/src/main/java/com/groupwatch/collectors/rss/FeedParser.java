package com.groupwatch.collectors.rss;

import com.groupwatch.core.model.Article;
import com.groupwatch.core.util.HtmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses RSS 2.0 and Atom documents with external entities and doctypes disabled. Publication dates keep the
 * offset written in the feed; undated entries get the epoch in UTC.
 */
public final class FeedParser {
    static final ZonedDateTime UNDATED = Instant.EPOCH.atZone(ZoneOffset.UTC);

    // RFC 822 zone names; RFC_1123_DATE_TIME only understands GMT and numeric offsets.
    private static final Map<String, String> RFC822_ZONES = Map.of(
            "UT", "+0000",
            "EST", "-0500",
            "EDT", "-0400",
            "CST", "-0600",
            "CDT", "-0500",
            "MST", "-0700",
            "MDT", "-0600",
            "PST", "-0800",
            "PDT", "-0700"
    );

    private FeedParser() {
    }

    /**
     * @throws FeedParseException if the document is not well-formed XML
     */
    public static ParsedFeed parse(String xml) {
        Document document;
        try {
            document = newBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (SAXException | IOException e) {
            throw new FeedParseException("Invalid RSS/Atom XML: " + e.getMessage(), e);
        }
        Element root = document.getDocumentElement();
        String rootName = root == null ? "" : root.getTagName().toLowerCase(Locale.ROOT);
        if ("rss".equals(rootName)) {
            return parseRss(document);
        }
        if ("feed".equals(rootName)) {
            return parseAtom(root);
        }
        return new ParsedFeed("", List.of());
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                }

                @Override
                public void error(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }
            });
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    private static ParsedFeed parseRss(Document document) {
        NodeList channels = document.getElementsByTagName("channel");
        String title = channels.getLength() == 0 ? "" : directChildText(channels.item(0), "title").orElse("");

        NodeList items = document.getElementsByTagName("item");
        List<Article> articles = new ArrayList<>();
        for (int i = 0; i < items.getLength(); i++) {
            Node item = items.item(i);
            String link = childText(item, "link").orElseGet(() -> childText(item, "guid").orElse(""));
            if (link.isEmpty()) {
                continue;
            }
            articles.add(new Article(
                    childText(item, "title").orElse("(untitled)"),
                    childText(item, "description").map(HtmlUtils::toPlainText).orElse(""),
                    link,
                    parseDate(childText(item, "pubDate").orElse(null))
            ));
        }
        return new ParsedFeed(title, articles);
    }

    private static ParsedFeed parseAtom(Element root) {
        String title = directChildText(root, "title").orElse("");

        NodeList entries = root.getElementsByTagName("entry");
        List<Article> articles = new ArrayList<>();
        for (int i = 0; i < entries.getLength(); i++) {
            Node entry = entries.item(i);
            String link = alternateLink(entry).orElse("");
            if (link.isEmpty()) {
                continue;
            }
            String summary = childText(entry, "summary").orElseGet(() -> childText(entry, "content").orElse(""));
            articles.add(new Article(
                    childText(entry, "title").orElse("(untitled)"),
                    HtmlUtils.toPlainText(summary),
                    link,
                    parseDate(childText(entry, "published").orElseGet(() -> childText(entry, "updated").orElse(null)))
            ));
        }
        return new ParsedFeed(title, articles);
    }

    private static Optional<String> childText(Node parent, String tagName) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList children = element.getElementsByTagName(tagName);
        if (children.getLength() == 0) {
            return Optional.empty();
        }
        return nonBlank(children.item(0).getTextContent());
    }

    private static Optional<String> directChildText(Node parent, String tagName) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child instanceof Element element && tagName.equals(element.getTagName())) {
                return nonBlank(element.getTextContent());
            }
        }
        return Optional.empty();
    }

    private static Optional<String> alternateLink(Node entry) {
        if (!(entry instanceof Element element)) {
            return Optional.empty();
        }
        NodeList links = element.getElementsByTagName("link");
        String fallback = null;
        for (int i = 0; i < links.getLength(); i++) {
            if (!(links.item(i) instanceof Element link)) {
                continue;
            }
            String href = link.getAttribute("href").trim();
            if (href.isEmpty()) {
                continue;
            }
            String rel = link.getAttribute("rel");
            if (rel.isEmpty() || "alternate".equals(rel)) {
                return Optional.of(href);
            }
            if (fallback == null) {
                fallback = href;
            }
        }
        return Optional.ofNullable(fallback);
    }

    private static Optional<String> nonBlank(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(text.trim());
    }

    static ZonedDateTime parseDate(String value) {
        if (value == null || value.isBlank()) {
            return UNDATED;
        }
        String trimmed = value.trim();
        List<Function<String, ZonedDateTime>> parsers = List.of(
                v -> ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME),
                v -> ZonedDateTime.parse(numericZone(v), DateTimeFormatter.RFC_1123_DATE_TIME),
                v -> OffsetDateTime.parse(v).toZonedDateTime(),
                v -> ZonedDateTime.parse(v)
        );
        return parsers.stream()
                .map(parser -> safelyParse(parser, trimmed))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .findFirst()
                .orElse(UNDATED);
    }

    private static String numericZone(String value) {
        int space = value.lastIndexOf(' ');
        String offset = space < 0 ? null : RFC822_ZONES.get(value.substring(space + 1).toUpperCase(Locale.ROOT));
        if (offset == null) {
            throw new DateTimeParseException("No RFC 822 zone name", value, 0);
        }
        return value.substring(0, space + 1) + offset;
    }

    private static Optional<ZonedDateTime> safelyParse(Function<String, ZonedDateTime> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
