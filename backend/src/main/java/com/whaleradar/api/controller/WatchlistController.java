package com.whaleradar.api.controller;

import com.whaleradar.api.dto.CursorResetResponse;
import com.whaleradar.api.dto.ElevateWalletRequest;
import com.whaleradar.api.dto.ElevateWalletResponse;
import com.whaleradar.api.dto.ErrorBody;
import com.whaleradar.api.dto.WatchlistResponse;
import com.whaleradar.api.validation.AddressValidator;
import com.whaleradar.scan.ScanCycleOrchestrator;
import com.whaleradar.watchlist.WatchlistManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Locale;
import java.util.OptionalLong;

/**
 * GET /watchlist, POST /watchlist/elevated, POST /watchlist/{address}/cursor/reset.
 */
@RestController
@RequestMapping("/api/v1/watchlist")
@RequiredArgsConstructor
public class WatchlistController {

    static final String DEFAULT_MANUAL_REASON = "Manual elevation";

    private final WatchlistManager watchlistManager;
    private final ScanCycleOrchestrator orchestrator;
    private final AddressValidator addressValidator;

    @GetMapping
    public WatchlistResponse watchlist() {
        return new WatchlistResponse(watchlistManager.watchedAddresses(), watchlistManager.elevatedAddresses());
    }

    @PostMapping("/elevated")
    public ResponseEntity<ElevateWalletResponse> elevate(@Valid @RequestBody ElevateWalletRequest request) {
        String address = request.address().trim().toLowerCase(Locale.ROOT);
        String reason = request.reason() == null || request.reason().isBlank()
                ? DEFAULT_MANUAL_REASON
                : request.reason().trim();
        boolean created = watchlistManager.elevateManually(address, reason);
        HttpStatus status = created ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(new ElevateWalletResponse(address, created));
    }

    @PostMapping("/{address}/cursor/reset")
    public ResponseEntity<?> resetCursor(@PathVariable String address) {
        if (!addressValidator.isValidAddress(address)) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid wallet address format"));
        }
        String normalized = address.trim().toLowerCase(Locale.ROOT);
        OptionalLong cursor = orchestrator.resetCursor(normalized);
        if (cursor.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorBody.of("NOT_WATCHED", "Address is not on the watchlist"));
        }
        long cursorMs = cursor.getAsLong();
        return ResponseEntity.accepted().body(new CursorResetResponse(normalized, cursorMs, Instant.ofEpochMilli(cursorMs)));
    }
}
