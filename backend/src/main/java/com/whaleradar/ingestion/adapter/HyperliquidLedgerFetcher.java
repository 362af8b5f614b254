package com.whaleradar.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whaleradar.common.RetryPolicy;
import com.whaleradar.domain.Fill;
import com.whaleradar.domain.TradeSide;
import com.whaleradar.domain.Transfer;
import com.whaleradar.domain.TransferKind;
import com.whaleradar.ingestion.config.LedgerProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Ledger fetcher backed by the Hyperliquid info API ({@code userFills}, {@code userNonFundingLedgerUpdates}).
 * Each logical call is rate-limited, bounded by the configured timeout and retried with backoff;
 * the final outcome is reported to every {@link LedgerCallListener}.
 */
@Component
@Slf4j
public class HyperliquidLedgerFetcher implements LedgerFetcher {

    static final String USER_FILLS = "userFills";
    static final String LEDGER_UPDATES = "userNonFundingLedgerUpdates";
    static final String SETTLEMENT_TOKEN = "USDC";

    private final HyperliquidInfoClient infoClient;
    private final LedgerProperties properties;
    private final RetryPolicy retryPolicy;
    private final RateLimiter ledgerRateLimiter;
    private final ObjectMapper objectMapper;
    private final List<LedgerCallListener> listeners;

    public HyperliquidLedgerFetcher(HyperliquidInfoClient infoClient,
                                    LedgerProperties properties,
                                    RetryPolicy ledgerRetryPolicy,
                                    @Qualifier("ledgerRateLimiter") RateLimiter ledgerRateLimiter,
                                    ObjectMapper objectMapper,
                                    List<LedgerCallListener> listeners) {
        this.infoClient = infoClient;
        this.properties = properties;
        this.retryPolicy = ledgerRetryPolicy;
        this.ledgerRateLimiter = ledgerRateLimiter;
        this.objectMapper = objectMapper;
        this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
    }

    @Override
    public List<Fill> fetchFills(String address, long sinceMs) {
        return callWithRetry(USER_FILLS, address, root -> parseFills(root, sinceMs));
    }

    @Override
    public List<Transfer> fetchTransfers(String address, long sinceMs) {
        return callWithRetry(LEDGER_UPDATES, address, root -> parseTransfers(root, sinceMs));
    }

    private <T> T callWithRetry(String requestType, String address, Function<JsonNode, T> parser) {
        Exception lastException = null;
        for (int attempt = 0; attempt < retryPolicy.maxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepBeforeRetry(requestType, attempt);
            }
            try {
                T parsed = parser.apply(call(requestType, address));
                notifySucceeded(requestType);
                return parsed;
            } catch (RuntimeException e) {
                lastException = e;
                log.debug("{} for {} failed (attempt {}/{}): {}",
                        requestType, address, attempt + 1, retryPolicy.maxAttempts(), messageOf(e));
            }
        }
        LedgerFetchException failure = lastException instanceof LedgerFetchException
                ? (LedgerFetchException) lastException
                : new LedgerFetchException(requestType + " failed for " + address + ": " + messageOf(lastException), lastException);
        notifyFailed(requestType, failure);
        throw failure;
    }

    private JsonNode call(String requestType, String address) {
        if (!ledgerRateLimiter.acquirePermission()) {
            throw new LedgerFetchException("Local limiter timeout before " + requestType + " for " + address);
        }
        String json = infoClient.post(properties.getInfoUrl(), Map.of("type", requestType, "user", address))
                .block(Duration.ofMillis(Math.max(1L, properties.getTimeoutMs())));
        if (json == null || json.isBlank()) {
            throw new LedgerFetchException("Empty " + requestType + " response for " + address);
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new LedgerFetchException("Malformed " + requestType + " response for " + address, e);
        }
    }

    private void sleepBeforeRetry(String requestType, int attempt) {
        try {
            Thread.sleep(retryPolicy.delayMs(attempt - 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerFetchException("Interrupted during " + requestType + " retry", e);
        }
    }

    private void notifySucceeded(String requestType) {
        for (LedgerCallListener listener : listeners) {
            listener.onCallSucceeded(requestType);
        }
    }

    private void notifyFailed(String requestType, Exception cause) {
        for (LedgerCallListener listener : listeners) {
            listener.onCallFailed(requestType, cause);
        }
    }

    static List<Fill> parseFills(JsonNode root, long sinceMs) {
        requireArray(root, USER_FILLS);
        List<Fill> fills = new ArrayList<>();
        for (JsonNode node : root) {
            long time = node.path("time").asLong(0L);
            if (time < sinceMs) {
                continue;
            }
            fills.add(new Fill(
                    node.path("coin").asText(""),
                    decimalOrZero(node.path("sz")),
                    decimalOrZero(node.path("px")),
                    TradeSide.parse(node.path("side").asText(null)),
                    node.path("dir").asText(""),
                    time,
                    node.path("tid").asText(""),
                    node.path("oid").asText("")));
        }
        return fills;
    }

    static List<Transfer> parseTransfers(JsonNode root, long sinceMs) {
        requireArray(root, LEDGER_UPDATES);
        List<Transfer> transfers = new ArrayList<>();
        for (JsonNode node : root) {
            long time = node.path("time").asLong(0L);
            if (time < sinceMs) {
                continue;
            }
            JsonNode delta = node.path("delta");
            if (!delta.isObject()) {
                continue;
            }
            TransferKind kind = TransferKind.parse(delta.path("type").asText(null));
            if (kind == TransferKind.OTHER) {
                continue;
            }
            transfers.add(new Transfer(
                    kind,
                    SETTLEMENT_TOKEN,
                    decimalOrZero(delta.path("usdc")).abs(),
                    time,
                    node.path("hash").asText("")));
        }
        return transfers;
    }

    private static void requireArray(JsonNode root, String requestType) {
        if (root == null || !root.isArray()) {
            throw new LedgerFetchException("Expected a JSON array from " + requestType
                    + " but got " + (root == null ? "nothing" : root.getNodeType()));
        }
    }

    /** Upstream encodes numbers as strings; missing or unparsable values become zero. */
    static BigDecimal decimalOrZero(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return BigDecimal.ZERO;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        String text = node.asText("").strip();
        if (text.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    private static String messageOf(Throwable e) {
        if (e == null) {
            return "unknown";
        }
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
