package com.goldprice.prices.client;

import com.goldprice.common.exception.FetchFailureException;
import com.goldprice.common.model.PriceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Single best-effort GET of a source page. Any transport failure or non-2xx
 * status surfaces as {@link FetchFailureException}; nothing is retried.
 */
public class DocumentFetcher {

    private static final Logger log = LoggerFactory.getLogger(DocumentFetcher.class);

    private final WebClient webClient;
    private final String userAgent;

    public DocumentFetcher(WebClient documentWebClient, String userAgent) {
        this.webClient = documentWebClient;
        this.userAgent = userAgent;
    }

    public Mono<String> fetch(PriceSource source, String url) {
        return Mono.defer(() -> webClient.get()
                .uri(URI.create(url))
                .header(HttpHeaders.USER_AGENT, userAgent)
                .retrieve()
                .bodyToMono(String.class))
            .defaultIfEmpty("")
            .doOnSuccess(body -> log.info("Document fetched. source={} chars={}", source.slug(), body.length()))
            .onErrorMap(e -> !(e instanceof FetchFailureException),
                        e -> new FetchFailureException(source.slug(), url, e))
            .doOnError(e -> log.error("Document fetch failed. source={} url={}", source.slug(), url, e.getCause()));
    }
}
