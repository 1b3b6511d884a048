package com.aisignal.data.feed;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses RSS 2.0 {@code <item>} and Atom {@code <entry>} documents.
 *
 * <p>{@link FeedEntry#getSource()} is the item's own {@code <source>} element, empty when there is
 * none; callers pick their own fallback.</p>
 */
public final class FeedParser {

    private FeedParser() {
    }

    public static List<FeedEntry> parse(String xml, int maxItems) throws FeedParseException {
        Document doc = readDocument(xml);
        List<FeedEntry> out = new ArrayList<>();
        NodeList items = doc.getElementsByTagName("item");
        for (int i = 0; i < items.getLength() && out.size() < maxItems; i++) {
            out.add(readRssItem((Element) items.item(i)));
        }
        NodeList entries = doc.getElementsByTagName("entry");
        for (int i = 0; i < entries.getLength() && out.size() < maxItems; i++) {
            out.add(readAtomEntry((Element) entries.item(i)));
        }
        return out;
    }

    private static Document readDocument(String xml) throws FeedParseException {
        if (xml == null || xml.isBlank()) {
            throw new FeedParseException("empty feed document", null);
        }
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder()
                    .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new FeedParseException("malformed feed document: " + e.getMessage(), e);
        }
    }

    private static FeedEntry readRssItem(Element item) {
        String title = text(item, "title");
        String link = text(item, "link");
        String author = firstNonBlank(text(item, "author"), text(item, "dc:creator"));
        return new FeedEntry(
                title,
                link,
                text(item, "description"),
                text(item, "source"),
                author.isEmpty() ? List.of() : List.of(author),
                parseRfc1123(text(item, "pubDate"))
        );
    }

    private static FeedEntry readAtomEntry(Element entry) {
        String link = text(entry, "id");
        NodeList links = entry.getElementsByTagName("link");
        for (int i = 0; i < links.getLength(); i++) {
            Element candidate = (Element) links.item(i);
            String rel = candidate.getAttribute("rel");
            if (rel.isEmpty() || "alternate".equals(rel)) {
                String href = candidate.getAttribute("href");
                if (!href.isBlank() && link.isBlank()) {
                    link = href;
                }
                break;
            }
        }
        List<String> authors = new ArrayList<>();
        NodeList authorNodes = entry.getElementsByTagName("author");
        for (int i = 0; i < authorNodes.getLength(); i++) {
            String name = text((Element) authorNodes.item(i), "name");
            if (!name.isBlank()) {
                authors.add(name.trim());
            }
        }
        return new FeedEntry(
                text(entry, "title"),
                link,
                firstNonBlank(text(entry, "summary"), text(entry, "content")),
                "",
                authors,
                parseIso(firstNonBlank(text(entry, "published"), text(entry, "updated")))
        );
    }

    private static String text(Element parent, String tag) {
        NodeList nl = parent.getElementsByTagName(tag);
        if (nl.getLength() == 0) {
            return "";
        }
        Node n = nl.item(0);
        return n == null || n.getTextContent() == null ? "" : n.getTextContent().trim();
    }

    private static ZonedDateTime parseRfc1123(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(raw.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
        } catch (Exception ignored) {
            return null;
        }
    }

    private static ZonedDateTime parseIso(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw.trim()).toZonedDateTime();
        } catch (Exception ignored) {
            return null;
        }
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a.trim();
        }
        return b == null ? "" : b.trim();
    }
}
