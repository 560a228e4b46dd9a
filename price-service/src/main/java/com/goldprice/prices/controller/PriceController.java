package com.goldprice.prices.controller;

import com.goldprice.common.exception.FetchFailureException;
import com.goldprice.common.exception.UnsupportedSourceException;
import com.goldprice.common.model.PriceSource;
import com.goldprice.prices.dto.PriceEnvelopeDTO;
import com.goldprice.prices.dto.PriceHistoryPointDTO;
import com.goldprice.prices.render.PriceEnvelopeRenderer;
import com.goldprice.prices.render.RssFeedRenderer;
import com.goldprice.prices.service.PriceScrapeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/prices-all")
public class PriceController {

    private static final Logger log = LoggerFactory.getLogger(PriceController.class);

    static final MediaType RSS_UTF8 = new MediaType(MediaType.APPLICATION_RSS_XML, StandardCharsets.UTF_8);

    private final PriceScrapeService scrapeService;
    private final PriceEnvelopeRenderer envelopeRenderer;
    private final RssFeedRenderer rssRenderer;

    public PriceController(PriceScrapeService scrapeService,
                           PriceEnvelopeRenderer envelopeRenderer,
                           RssFeedRenderer rssRenderer) {
        this.scrapeService    = scrapeService;
        this.envelopeRenderer = envelopeRenderer;
        this.rssRenderer      = rssRenderer;
    }

    @GetMapping
    public Mono<Map<String, Object>> supportedSites() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Prices All API - Get all gold prices per weight");
        body.put("supportedSites", scrapeService.supportedSources().stream().map(PriceSource::slug).toList());
        body.put("usage", Map.of(
            "json", "/prices-all/:site?category=&withChanges=",
            "rss", "/prices-all/:site/rss?category=",
            "history", "/prices-all/:site/history?category=&weight=&limit="));
        body.put("examples", Map.of(
            "json", "/prices-all/anekalogam",
            "rss", "/prices-all/anekalogam/rss",
            "history", "/prices-all/anekalogam/history?weight=1"));
        return Mono.just(body);
    }

    @GetMapping("/{site}")
    public Mono<PriceEnvelopeDTO> prices(@PathVariable String site,
                                         @RequestParam(required = false) String category,
                                         @RequestParam(defaultValue = "false") boolean withChanges) {
        log.info("Price request received. site={} category={} withChanges={}", site, category, withChanges);
        return (withChanges
                ? scrapeService.runWithDeltas(site, category)
                : scrapeService.run(site, category))
            .map(envelopeRenderer::render);
    }

    @GetMapping(value = "/{site}/rss", produces = MediaType.APPLICATION_RSS_XML_VALUE)
    public Mono<ResponseEntity<String>> rss(@PathVariable String site,
                                            @RequestParam(required = false) String category) {
        log.info("RSS request received. site={} category={}", site, category);
        return scrapeService.runWithDeltas(site, category)
            .map(result -> ResponseEntity.ok().contentType(RSS_UTF8).body(rssRenderer.render(result)))
            .onErrorResume(e -> {
                HttpStatus status = statusFor(e);
                log.warn("RSS request failed. site={} status={} reason={}", site, status.value(), e.getMessage());
                return Mono.just(ResponseEntity.status(status)
                    .contentType(RSS_UTF8)
                    .body(rssRenderer.renderError(site, e.getMessage())));
            });
    }

    @GetMapping("/{site}/history")
    public Flux<PriceHistoryPointDTO> history(@PathVariable String site,
                                              @RequestParam(required = false) String category,
                                              @RequestParam BigDecimal weight,
                                              @RequestParam(required = false) Integer limit) {
        log.info("History request received. site={} category={} weight={} limit={}", site, category, weight, limit);
        return scrapeService.history(site, category, weight, limit)
            .map(PriceHistoryPointDTO::from);
    }

    private static HttpStatus statusFor(Throwable e) {
        if (e instanceof UnsupportedSourceException) return HttpStatus.BAD_REQUEST;
        if (e instanceof FetchFailureException) return HttpStatus.BAD_GATEWAY;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
