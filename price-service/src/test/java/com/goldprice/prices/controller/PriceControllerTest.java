package com.goldprice.prices.controller;

import com.goldprice.common.exception.FetchFailureException;
import com.goldprice.common.exception.UnsupportedSourceException;
import com.goldprice.common.model.CanonicalPriceRecord;
import com.goldprice.common.model.PriceSource;
import com.goldprice.common.model.PriceWithDelta;
import com.goldprice.common.model.ScrapeMeta;
import com.goldprice.common.model.ScrapeResult;
import com.goldprice.common.model.StoredSnapshot;
import com.goldprice.prices.render.PriceEnvelopeRenderer;
import com.goldprice.prices.render.RssFeedRenderer;
import com.goldprice.prices.service.PriceScrapeService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@WebFluxTest(PriceController.class)
@Import({PriceEnvelopeRenderer.class, RssFeedRenderer.class, ScrapeExceptionHandler.class, PriceControllerTest.FixedClock.class})
class PriceControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-28T07:05:00Z");

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private PriceScrapeService scrapeService;

    private static final CanonicalPriceRecord ONE_GRAM = new CanonicalPriceRecord(PriceSource.ANEKALOGAM, "antam",
        BigDecimal.ONE, 1_005_000, 950_000, true, "28 January 2026 14.02", NOW);

    private static ScrapeResult result() {
        return new ScrapeResult(List.of(ONE_GRAM),
            new ScrapeMeta(PriceSource.ANEKALOGAM, PriceSource.ANEKALOGAM.defaultUrl(), "28 January 2026 14.02", NOW),
            List.of());
    }

    @Test
    @DisplayName("GET /prices-all lists supported sites")
    void supportedSites() {
        when(scrapeService.supportedSources()).thenReturn(Arrays.asList(PriceSource.values()));

        webTestClient.get().uri("/prices-all")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.supportedSites.length()").isEqualTo(4)
            .jsonPath("$.supportedSites[3]").isEqualTo("galeri24")
            .jsonPath("$.usage.rss").exists();
    }

    @Nested
    @DisplayName("GET /prices-all/{site}")
    class PricesTests {

        @Test
        @DisplayName("plain envelope has no change fields")
        void plainEnvelope() {
            when(scrapeService.run("anekalogam", null)).thenReturn(Mono.just(result()));

            webTestClient.get().uri("/prices-all/anekalogam")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data[0].unit").isEqualTo("gram")
                .jsonPath("$.data[0].sell").isEqualTo(1_005_000)
                .jsonPath("$.data[0].buy").isEqualTo(950_000)
                .jsonPath("$.data[0].type").isEqualTo("antam")
                .jsonPath("$.data[0].sellChange").doesNotExist()
                .jsonPath("$.meta.source").isEqualTo("anekalogam")
                .jsonPath("$.meta.lastUpdated").isEqualTo("28 January 2026 14.02");
        }

        @Test
        @DisplayName("withChanges=true adds sellChange and buyChange")
        void withChanges() {
            when(scrapeService.runWithDeltas("anekalogam", "antam"))
                .thenReturn(Mono.just(result().withDeltas(List.of(new PriceWithDelta(ONE_GRAM, 5_000, 0)))));

            webTestClient.get().uri("/prices-all/anekalogam?category=antam&withChanges=true")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data[0].sellChange").isEqualTo(5_000)
                .jsonPath("$.data[0].buyChange").isEqualTo(0);
        }

        @Test
        @DisplayName("unsupported site → 400 with the supported list")
        void unsupported() {
            when(scrapeService.run("foo", null))
                .thenReturn(Mono.error(new UnsupportedSourceException("foo", PriceSource.selectors())));

            webTestClient.get().uri("/prices-all/foo")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.source").isEqualTo("foo")
                .jsonPath("$.supportedSources.length()").isEqualTo(4);
        }

        @Test
        @DisplayName("upstream failure → 502")
        void upstreamFailure() {
            when(scrapeService.run("indogold", null)).thenReturn(Mono.error(
                new FetchFailureException("indogold", PriceSource.INDOGOLD.defaultUrl(), new RuntimeException("timeout"))));

            webTestClient.get().uri("/prices-all/indogold")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.source").isEqualTo("indogold");
        }
    }

    @Nested
    @DisplayName("GET /prices-all/{site}/rss")
    class RssTests {

        @Test
        @DisplayName("feed is served as application/rss+xml")
        void feed() {
            when(scrapeService.runWithDeltas("anekalogam", null))
                .thenReturn(Mono.just(result().withDeltas(List.of(new PriceWithDelta(ONE_GRAM, 5_000, 0)))));

            webTestClient.get().uri("/prices-all/anekalogam/rss")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_RSS_XML)
                .expectBody(String.class)
                .value(body -> {
                    assertTrue(body.startsWith("<?xml"));
                    assertTrue(body.contains("▲ Rp 5.000"));
                });
        }

        @Test
        @DisplayName("unsupported site → 400 with an error feed")
        void errorFeed() {
            when(scrapeService.runWithDeltas("foo", null))
                .thenReturn(Mono.error(new UnsupportedSourceException("foo", PriceSource.selectors())));

            webTestClient.get().uri("/prices-all/foo/rss")
                .exchange()
                .expectStatus().isBadRequest()
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_RSS_XML)
                .expectBody(String.class)
                .value(body -> {
                    assertTrue(body.contains("<rss version=\"2.0\""));
                    assertTrue(body.contains("is not supported"));
                });
        }
    }

    @Test
    @DisplayName("GET /prices-all/{site}/history returns the stored series")
    void history() {
        StoredSnapshot stored = new StoredSnapshot(PriceSource.ANEKALOGAM, "antam", BigDecimal.ONE,
            1_000_000, 950_000, true, "27 January 2026 14.00", NOW.minusSeconds(86_400));
        when(scrapeService.history(eq("anekalogam"), isNull(), any(BigDecimal.class), eq(5)))
            .thenReturn(Flux.just(stored));

        webTestClient.get().uri("/prices-all/anekalogam/history?weight=1&limit=5")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].sell").isEqualTo(1_000_000)
            .jsonPath("$[0].publishedAt").isEqualTo("27 January 2026 14.00");
    }
}
