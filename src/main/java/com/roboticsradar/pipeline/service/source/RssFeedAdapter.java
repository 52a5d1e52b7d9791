package com.roboticsradar.pipeline.service.source;

import com.roboticsradar.pipeline.config.SourceSettings;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.SourceKind;
import com.roboticsradar.pipeline.util.TextNormalizer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import reactor.core.publisher.Flux;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * RSS 2.0 and Atom feeds. {@code <item>} and {@code <entry>} elements become items; HTML
 * summaries are reduced to text and the channel language is carried onto every item.
 */
@Service
public class RssFeedAdapter extends HttpSourceAdapter {

    public RssFeedAdapter(@Qualifier("sourceClient") WebClient http, Clock clock) {
        super(http, clock);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.RSS;
    }

    @Override
    public Flux<Item> fetch(SourceSettings source) {
        return get(source, source.getUrl(), h -> h.set("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml"))
                .flatMapIterable(xml -> parse(xml, source));
    }

    List<Item> parse(String xml, SourceSettings source) {
        Document doc = readDocument(xml, source);
        List<Item> items = new ArrayList<>();

        NodeList rss = doc.getElementsByTagName("item");
        if (rss.getLength() > 0) {
            String language = firstText(doc.getDocumentElement(), "language");
            int lim = Math.min(rss.getLength(), source.getLimit());
            for (int i = 0; i < lim; i++) {
                try {
                    items.add(fromRssItem((Element) rss.item(i), source, language));
                } catch (MalformedItemException e) {
                    logSkipped(source, e);
                }
            }
            return items;
        }

        NodeList atom = doc.getElementsByTagName("entry");
        String language = doc.getDocumentElement().getAttribute("xml:lang");
        int lim = Math.min(atom.getLength(), source.getLimit());
        for (int i = 0; i < lim; i++) {
            try {
                items.add(fromAtomEntry((Element) atom.item(i), source, language));
            } catch (MalformedItemException e) {
                logSkipped(source, e);
            }
        }
        return items;
    }

    private static Document readDocument(String xml, SourceSettings source) {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(false);
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            dbf.setExpandEntityReferences(false);
            DocumentBuilder db = dbf.newDocumentBuilder();
            Document doc = db.parse(new InputSource(new StringReader(xml)));
            doc.getDocumentElement().normalize();
            return doc;
        } catch (Exception e) {
            throw new SourceUnavailableException(source.getName(), "response is not a readable feed: " + e.getMessage(), e);
        }
    }

    private Item fromRssItem(Element e, SourceSettings source, String language) {
        String title = firstText(e, "title");
        String link = firstText(e, "link");
        String guid = firstText(e, "guid");
        String html = firstText(e, "content:encoded");
        if (html.isEmpty()) html = firstText(e, "description");
        String date = firstText(e, "pubDate");
        if (date.isEmpty()) date = firstText(e, "dc:date");
        String author = firstText(e, "dc:creator");
        if (author.isEmpty()) author = firstText(e, "author");
        return build(source, guid.isEmpty() ? link : guid, title, html, link, date, author, language);
    }

    private Item fromAtomEntry(Element e, SourceSettings source, String language) {
        String title = firstText(e, "title");
        String link = atomLink(e);
        String id = firstText(e, "id");
        String html = firstText(e, "content");
        if (html.isEmpty()) html = firstText(e, "summary");
        String date = firstText(e, "published");
        if (date.isEmpty()) date = firstText(e, "updated");
        String author = "";
        NodeList authors = e.getElementsByTagName("author");
        if (authors.getLength() > 0) author = firstText((Element) authors.item(0), "name");
        return build(source, id.isEmpty() ? link : id, title, html, link, date, author, language);
    }

    private Item build(SourceSettings source, String externalId, String title, String html, String link,
                       String date, String author, String language) {
        if (title.isEmpty() && link.isEmpty()) {
            throw new MalformedItemException("entry has neither title nor link");
        }
        String id = externalId.isEmpty() ? Integer.toHexString(title.hashCode()) : externalId;

        Item item = new Item();
        item.setExternalId(id);
        item.setSourceKind(SourceKind.RSS);
        item.setSourceName(source.getName());
        item.setTitle(TextNormalizer.sanitizeTitle(htmlToText(title)));
        item.setBody(htmlToText(html));
        item.setUrl(link);
        item.setAuthorName(author.isEmpty() ? null : author);
        item.setAuthorId(author.isEmpty() ? null : author);
        item.setLanguage(language == null || language.isBlank() ? null : language.trim());
        applyTimestamp(item, parseDate(date));
        return item;
    }

    /** RFC-1123 (RSS) or ISO-8601 (Atom, dc:date); null when absent or unparseable. */
    static OffsetDateTime parseDate(String s) {
        if (s == null || s.isBlank()) return null;
        String v = s.trim();
        try {
            return ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toOffsetDateTime();
        } catch (DateTimeParseException notRfc) {
            try {
                return OffsetDateTime.parse(v);
            } catch (DateTimeParseException notIso) {
                return null;
            }
        }
    }

    private static String atomLink(Element e) {
        NodeList links = e.getElementsByTagName("link");
        String fallback = "";
        for (int i = 0; i < links.getLength(); i++) {
            Element l = (Element) links.item(i);
            String rel = l.getAttribute("rel");
            String href = l.getAttribute("href").trim();
            if (href.isEmpty()) href = l.getTextContent().trim();
            if (rel.isEmpty() || "alternate".equals(rel)) return href;
            if (fallback.isEmpty()) fallback = href;
        }
        return fallback;
    }

    private static String firstText(Element parent, String tag) {
        NodeList nl = parent.getElementsByTagName(tag);
        if (nl.getLength() == 0) return "";
        String t = nl.item(0).getTextContent();
        return t == null ? "" : t.trim();
    }
}
