package com.whaleradar.ingestion.adapter;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Hyperliquid info client using WebClient. Used by HyperliquidLedgerFetcher.
 */
public class WebClientHyperliquidInfoClient implements HyperliquidInfoClient {

    private final WebClient webClient;
    private final String userAgent;

    public WebClientHyperliquidInfoClient(WebClient.Builder builder, String userAgent) {
        this.webClient = builder.build();
        this.userAgent = userAgent;
    }

    @Override
    public Mono<String> post(String endpointUrl, Map<String, Object> payload) {
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.USER_AGENT, userAgent)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> new LedgerFetchException("Info API " + e.getStatusCode().value() + ": " + e.getMessage(), e));
    }
}
