package com.lexintel.collectors.rss;

import com.lexintel.collectors.api.FetchContext;
import com.lexintel.collectors.api.FetchResult;
import com.lexintel.collectors.config.RssSourceConfig;
import com.lexintel.collectors.support.FixtureUtils;
import com.lexintel.core.model.RawRecord;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RssSourceFetcherTest {
    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void parsesRssItemsWithBodiesAndSkipsUntitledOnes() {
        List<RawRecord> records = RssSourceFetcher.parseRecords(FixtureUtils.readFixture("fixtures/sample-rss.xml"), "wire");

        assertEquals(3, records.size());
        RawRecord first = records.get(0);
        assertEquals("Robotics startup closes Series B", first.title());
        assertEquals("wire-1", first.sourceId());
        assertEquals("The company raised $120M to scale production.", first.body());
        assertEquals(Instant.parse("2026-02-09T18:00:00Z"), first.publishedAt());

        RawRecord second = records.get(1);
        assertTrue(second.body().startsWith("Full text of the draft rules"));
        assertNull(second.publishedAt());
        assertNull(second.sourceId());

        assertEquals("", records.get(2).body());
        assertTrue(records.stream().allMatch(record -> record.source().equals("wire")));
    }

    @Test
    void parsesAtomEntriesPreferringPublishedDate() {
        List<RawRecord> records = RssSourceFetcher.parseRecords(FixtureUtils.readFixture("fixtures/sample-atom.xml"), "atom");

        assertEquals(2, records.size());
        assertEquals("Atom headline one", records.get(0).title());
        assertEquals("https://atom.example.com/1", records.get(0).url());
        assertEquals(Instant.parse("2026-02-09T08:30:00Z"), records.get(0).publishedAt());
        assertEquals("First summary", records.get(0).body());
        assertEquals(Instant.parse("2026-02-08T02:00:00Z"), records.get(1).publishedAt());
        assertEquals("Second body", records.get(1).body());
    }

    @Test
    void fetchReturnsOkWithAtMostMaxItems() throws Exception {
        String rss = FixtureUtils.readFixture("fixtures/sample-rss.xml");
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/rss", exchange -> writeResponse(exchange, 200, rss));
        server.start();

        RssSourceFetcher fetcher = new RssSourceFetcher(new RssSourceConfig("wire", url("/rss")), 2);
        FetchResult result = fetcher.fetch(context(Duration.ofSeconds(2))).join();

        FetchResult.Ok ok = assertInstanceOf(FetchResult.Ok.class, result);
        assertEquals("wire", ok.source());
        assertEquals(2, ok.records().size());
    }

    @Test
    void serverErrorsAndMalformedXmlBecomeErrResults() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/down", exchange -> writeResponse(exchange, 503, "unavailable"));
        server.createContext("/broken", exchange -> writeResponse(exchange, 200, "<rss><channel><item><title>broken"));
        server.start();

        FetchResult down = new RssSourceFetcher(new RssSourceConfig("down", url("/down")), 10)
                .fetch(context(Duration.ofSeconds(2))).join();
        FetchResult broken = new RssSourceFetcher(new RssSourceConfig("broken", url("/broken")), 10)
                .fetch(context(Duration.ofSeconds(2))).join();

        assertFalse(down.success());
        assertTrue(((FetchResult.Err) down).message().contains("503"));
        assertFalse(broken.success());
        assertTrue(((FetchResult.Err) broken).message().contains("Invalid RSS/Atom XML"));
    }

    @Test
    void slowFeedTimesOutAsErr() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            writeResponse(exchange, 200, "<rss/>");
        });
        server.start();

        FetchResult result = new RssSourceFetcher(new RssSourceConfig("slow", url("/slow")), 10)
                .fetch(context(Duration.ofMillis(200))).join();

        assertFalse(result.success());
        assertEquals("slow", result.source());
    }

    @Test
    void invalidUrlIsReportedWithoutThrowing() {
        FetchResult result = new RssSourceFetcher(new RssSourceConfig("bad", "not a url"), 10)
                .fetch(context(Duration.ofSeconds(1))).join();

        assertFalse(result.success());
    }

    private String url(String path) {
        return "http://localhost:" + server.getAddress().getPort() + path;
    }

    private static FetchContext context(Duration timeout) {
        return new FetchContext(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(),
                Clock.fixed(Instant.parse("2026-02-09T20:00:00Z"), ZoneOffset.UTC),
                timeout
        );
    }

    private static void writeResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
