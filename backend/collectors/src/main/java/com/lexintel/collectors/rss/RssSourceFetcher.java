package com.lexintel.collectors.rss;

import com.lexintel.collectors.api.FetchContext;
import com.lexintel.collectors.api.FetchResult;
import com.lexintel.collectors.api.SourceFetcher;
import com.lexintel.collectors.config.RssSourceConfig;
import com.lexintel.core.model.RawRecord;
import com.lexintel.core.util.HtmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Logger;

public class RssSourceFetcher implements SourceFetcher {
    private static final Logger LOGGER = Logger.getLogger(RssSourceFetcher.class.getName());

    private final RssSourceConfig source;
    private final int maxItems;

    public RssSourceFetcher(RssSourceConfig source, int maxItems) {
        this.source = source;
        this.maxItems = Math.max(1, maxItems);
    }

    @Override
    public String name() {
        return source.source();
    }

    @Override
    public CompletableFuture<FetchResult> fetch(FetchContext ctx) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(source.url()))
                    .GET()
                    .header("User-Agent", "lex-intel/0.1")
                    .timeout(ctx.requestTimeout())
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(FetchResult.err(name(), "Invalid feed URL: " + source.url()));
        }

        return ctx.httpClient().sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        return FetchResult.err(name(), "Feed fetch failed: " + rootMessage(error));
                    }
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        return FetchResult.err(name(), "Feed returned HTTP " + response.statusCode());
                    }
                    ParseOutcome parsed = parseRecordsOutcome(response.body(), name());
                    if (parsed.invalidXml()) {
                        return FetchResult.err(name(), "Invalid RSS/Atom XML");
                    }
                    List<RawRecord> records = parsed.records().stream().limit(maxItems).toList();
                    LOGGER.fine(() -> "Fetched " + records.size() + " records from " + name());
                    return FetchResult.ok(name(), records);
                });
    }

    static List<RawRecord> parseRecords(String xml, String source) {
        return parseRecordsOutcome(xml, source).records();
    }

    private static ParseOutcome parseRecordsOutcome(String xml, String source) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);

            var builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                    LOGGER.fine(() -> "Feed XML warning: " + exception.getMessage());
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

            Document document = builder.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
            Element root = document.getDocumentElement();
            if (root == null) {
                return new ParseOutcome(List.of(), false);
            }
            String rootName = root.getTagName().toLowerCase(Locale.ROOT);
            if ("rss".equals(rootName)) {
                return new ParseOutcome(parseRss(document, source), false);
            }
            if ("feed".equals(rootName)) {
                return new ParseOutcome(parseAtom(document, source), false);
            }
            return new ParseOutcome(List.of(), false);
        } catch (Exception e) {
            return new ParseOutcome(List.of(), true);
        }
    }

    private static List<RawRecord> parseRss(Document document, String source) {
        NodeList items = document.getElementsByTagName("item");
        List<RawRecord> records = new ArrayList<>();
        for (int i = 0; i < items.getLength(); i++) {
            Node item = items.item(i);
            Optional<String> title = childText(item, "title").filter(text -> !text.isBlank());
            if (title.isEmpty()) {
                continue;
            }
            String body = longest(childText(item, "content:encoded"), childText(item, "description"));
            records.add(new RawRecord(
                    source,
                    childText(item, "guid").filter(text -> !text.isBlank()).orElse(null),
                    title.get(),
                    HtmlUtils.toPlainText(body),
                    childText(item, "link").filter(text -> !text.isBlank()).orElse(null),
                    parseDate(childText(item, "pubDate").orElse(null))
            ));
        }
        return records;
    }

    private static List<RawRecord> parseAtom(Document document, String source) {
        NodeList entries = document.getElementsByTagName("entry");
        List<RawRecord> records = new ArrayList<>();
        for (int i = 0; i < entries.getLength(); i++) {
            Node entry = entries.item(i);
            Optional<String> title = childText(entry, "title").filter(text -> !text.isBlank());
            if (title.isEmpty()) {
                continue;
            }
            String body = longest(childText(entry, "content"), childText(entry, "summary"));
            String date = childText(entry, "published").orElseGet(() -> childText(entry, "updated").orElse(null));
            records.add(new RawRecord(
                    source,
                    childText(entry, "id").filter(text -> !text.isBlank()).orElse(null),
                    title.get(),
                    HtmlUtils.toPlainText(body),
                    childAttribute(entry, "link", "href").orElse(null),
                    parseDate(date)
            ));
        }
        return records;
    }

    private static String longest(Optional<String> first, Optional<String> second) {
        String a = first.orElse("");
        String b = second.orElse("");
        return a.length() >= b.length() ? a : b;
    }

    private static Optional<String> childText(Node parent, String tagName) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList children = element.getElementsByTagName(tagName);
        if (children.getLength() == 0) {
            return Optional.empty();
        }
        String text = children.item(0).getTextContent();
        return text == null ? Optional.empty() : Optional.of(text.trim());
    }

    private static Optional<String> childAttribute(Node parent, String tagName, String attribute) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList children = element.getElementsByTagName(tagName);
        if (children.getLength() == 0) {
            return Optional.empty();
        }
        Node node = children.item(0);
        if (!(node instanceof Element child)) {
            return Optional.empty();
        }
        String value = child.getAttribute(attribute);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    // Missing or unparseable dates yield null; the normalizer falls back to scrape time.
    static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        List<Function<String, Instant>> parsers = List.of(
                Instant::parse,
                v -> OffsetDateTime.parse(v).toInstant(),
                v -> ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant()
        );
        String trimmed = value.trim();
        return parsers.stream()
                .map(parser -> safelyParse(parser, trimmed))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .findFirst()
                .orElse(null);
    }

    private static Optional<Instant> safelyParse(Function<String, Instant> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    private record ParseOutcome(List<RawRecord> records, boolean invalidXml) {
    }
}
