package com.whaleradar.watchlist;

import com.whaleradar.domain.ElevatedWallet;
import com.whaleradar.domain.ElevationOrigin;
import com.whaleradar.ingestion.store.EventStore;
import com.whaleradar.watchlist.config.WatchlistProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Watched and elevated address sets. Seeds come from configuration; elevated entries persisted in the
 * store (cluster promotions, manual elevations) are loaded on first use and kept in sync on every write.
 * Elevated is always a subset of watched; both sets only grow. Addresses are compared in lower case.
 */
@Service
@Slf4j
public class WatchlistManager {

    private final EventStore eventStore;
    private final Set<String> watched = ConcurrentHashMap.newKeySet();
    private final Set<String> elevated = ConcurrentHashMap.newKeySet();
    private final Object loadLock = new Object();
    private volatile boolean loaded;

    public WatchlistManager(WatchlistProperties properties, EventStore eventStore) {
        this.eventStore = eventStore;
        addAllNormalized(properties.getWatchAddresses(), watched);
        addAllNormalized(properties.getElevatedAddresses(), elevated);
        watched.addAll(elevated);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        ensureLoaded();
        log.info("Watchlist ready: {} watched, {} elevated", watched.size(), elevated.size());
    }

    /**
     * Elevates every wallet not yet elevated. Idempotent: already elevated wallets are skipped.
     *
     * @return wallets elevated by this call, in input order
     */
    public List<String> promote(Collection<String> wallets, String reason) {
        ensureLoaded();
        List<String> promoted = new ArrayList<>();
        for (String wallet : wallets) {
            String address = normalize(wallet);
            if (address == null || elevated.contains(address)) {
                continue;
            }
            boolean created = eventStore.addElevated(address, reason, ElevationOrigin.CLUSTER);
            elevated.add(address);
            watched.add(address);
            if (created) {
                promoted.add(address);
                log.info("Elevated {}: {}", address, reason);
            }
        }
        return promoted;
    }

    /** Operator elevation. Returns false when the address was already elevated. */
    public boolean elevateManually(String address, String reason) {
        ensureLoaded();
        String normalized = normalize(address);
        if (normalized == null || elevated.contains(normalized)) {
            return false;
        }
        boolean created = eventStore.addElevated(normalized, reason, ElevationOrigin.MANUAL);
        elevated.add(normalized);
        watched.add(normalized);
        log.info("Elevated {} manually: {}", normalized, reason);
        return created;
    }

    public boolean isElevated(String address) {
        ensureLoaded();
        String normalized = normalize(address);
        return normalized != null && elevated.contains(normalized);
    }

    public boolean isWatched(String address) {
        ensureLoaded();
        String normalized = normalize(address);
        return normalized != null && watched.contains(normalized);
    }

    /** Sorted snapshot. */
    public List<String> watchedAddresses() {
        ensureLoaded();
        return watched.stream().sorted().toList();
    }

    /** Sorted snapshot. */
    public List<String> elevatedAddresses() {
        ensureLoaded();
        return elevated.stream().sorted().toList();
    }

    /** Reloads persisted elevated wallets into the cache. */
    public void refresh() {
        List<ElevatedWallet> persisted = eventStore.listElevated();
        for (ElevatedWallet wallet : persisted) {
            String address = normalize(wallet.getId());
            if (address != null) {
                elevated.add(address);
                watched.add(address);
            }
        }
        log.debug("Loaded {} persisted elevated wallets", persisted.size());
    }

    /** Readers block until the first successful load; after a store failure the next access retries. */
    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (loadLock) {
            if (loaded) {
                return;
            }
            try {
                refresh();
                loaded = true;
            } catch (DataAccessException e) {
                log.warn("Could not load elevated wallets, will retry on next access: {}", e.getMessage());
            }
        }
    }

    private static void addAllNormalized(Collection<String> source, Set<String> target) {
        if (source == null) {
            return;
        }
        for (String address : source) {
            String normalized = normalize(address);
            if (normalized != null) {
                target.add(normalized);
            }
        }
    }

    static String normalize(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        return address.strip().toLowerCase(Locale.ROOT);
    }
}
