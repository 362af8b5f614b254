package com.whaleradar.ingestion.adapter;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Raw POST to the Hyperliquid info endpoint; returns the response body as a JSON string.
 */
public interface HyperliquidInfoClient {

    Mono<String> post(String endpointUrl, Map<String, Object> payload);
}
