package com.whaleradar.ingestion.store;

import com.mongodb.client.result.UpdateResult;
import com.whaleradar.common.ContentDigest;
import com.whaleradar.domain.ElevatedWallet;
import com.whaleradar.domain.ElevatedWalletRepository;
import com.whaleradar.domain.ElevationOrigin;
import com.whaleradar.domain.LargeTrade;
import com.whaleradar.domain.LargeTradeRepository;
import com.whaleradar.domain.ScanCursor;
import com.whaleradar.domain.SeenDigest;
import com.whaleradar.domain.SeenDigestRepository;
import com.whaleradar.domain.TradeCluster;
import com.whaleradar.domain.TradeClusterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Durable state of the scanner: seen digests, resume cursors, the large-trade archive,
 * detected clusters and elevated wallets. Every write is a single-document atomic operation;
 * concurrent address workers may interleave freely.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventStore {

    static final String CURSOR_KEY_PREFIX = "hyperliquid:addr:";

    private final MongoTemplate mongoTemplate;
    private final SeenDigestRepository seenDigestRepository;
    private final LargeTradeRepository largeTradeRepository;
    private final TradeClusterRepository tradeClusterRepository;
    private final ElevatedWalletRepository elevatedWalletRepository;
    private final Clock clock;

    public static String cursorKey(String address) {
        return CURSOR_KEY_PREFIX + address;
    }

    public boolean isSeen(String digest) {
        return seenDigestRepository.existsById(digest);
    }

    /**
     * Insert-if-absent. Returns true only for the call that created the record, so concurrent callers
     * racing on one digest see exactly one winner.
     */
    public boolean markSeen(String digest) {
        Query query = Query.query(Criteria.where("_id").is(digest));
        Update update = new Update().setOnInsert("createdAt", Instant.now(clock));
        try {
            UpdateResult result = mongoTemplate.upsert(query, update, SeenDigest.class);
            return result.getUpsertedId() != null;
        } catch (DuplicateKeyException e) {
            log.debug("Digest {} inserted concurrently", digest);
            return false;
        }
    }

    /**
     * Cursor for the source, or the fallback on first use. The fallback is persisted in the same
     * atomic operation so a crash before the next {@link #setCursor} keeps it.
     */
    public long getCursor(String source, long fallbackMs) {
        Query query = Query.query(Criteria.where("_id").is(source));
        Update update = new Update()
                .setOnInsert("lastMs", fallbackMs)
                .setOnInsert("updatedAt", Instant.now(clock));
        ScanCursor cursor = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), ScanCursor.class);
        return cursor != null ? cursor.getLastMs() : fallbackMs;
    }

    /** Advances the cursor; never moves it backwards. */
    public void setCursor(String source, long timestampMs) {
        Query query = Query.query(Criteria.where("_id").is(source));
        Update update = new Update()
                .max("lastMs", timestampMs)
                .set("updatedAt", Instant.now(clock));
        mongoTemplate.upsert(query, update, ScanCursor.class);
    }

    /** Operator rewind: overwrites the cursor unconditionally. */
    public void resetCursor(String source, long timestampMs) {
        Query query = Query.query(Criteria.where("_id").is(source));
        Update update = new Update()
                .set("lastMs", timestampMs)
                .set("updatedAt", Instant.now(clock));
        mongoTemplate.upsert(query, update, ScanCursor.class);
        log.info("Cursor {} reset to {}", source, timestampMs);
    }

    /**
     * Archives a trade for cluster scans. Keyed by trade id (content hash when upstream gives none);
     * re-archiving replaces the document.
     */
    public LargeTrade recordLargeTrade(LargeTrade trade) {
        if (trade.getId() == null || trade.getId().isBlank()) {
            trade.setId(ContentDigest.sha256(trade.getWalletAddress(), trade.getInstrument(),
                    String.valueOf(trade.getTimestampMs())));
        }
        trade.setRecordedAt(Instant.now(clock));
        return largeTradeRepository.save(trade);
    }

    /** Trades at or above minNotional whose timestamp lies within the last windowMinutes, newest first. */
    public List<LargeTrade> recentLargeTrades(int windowMinutes, BigDecimal minNotional) {
        long cutoffMs = clock.millis() - windowMinutes * 60_000L;
        return largeTradeRepository.findByTimestampMsGreaterThanEqualAndNotionalGreaterThanEqualOrderByTimestampMsDesc(
                cutoffMs, minNotional);
    }

    public long pruneLargeTradesOlderThan(long cutoffMs) {
        return largeTradeRepository.deleteByTimestampMsLessThan(cutoffMs);
    }

    /** Inserts the cluster. Returns false when a cluster with the same id already exists. */
    public boolean saveCluster(TradeCluster cluster) {
        try {
            mongoTemplate.insert(cluster);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Cluster {} already stored", cluster.getId());
            return false;
        }
    }

    public List<TradeCluster> recentClusters(int limit) {
        return tradeClusterRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Insert-if-absent keyed by lower-case address. Returns true when a new entry was created;
     * an existing entry keeps its original reason and origin.
     */
    public boolean addElevated(String address, String reason, ElevationOrigin origin) {
        String id = address.toLowerCase(Locale.ROOT);
        Query query = Query.query(Criteria.where("_id").is(id));
        Update update = new Update()
                .setOnInsert("reason", reason)
                .setOnInsert("origin", origin)
                .setOnInsert("addedAt", Instant.now(clock));
        try {
            UpdateResult result = mongoTemplate.upsert(query, update, ElevatedWallet.class);
            return result.getUpsertedId() != null;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public List<ElevatedWallet> listElevated() {
        return elevatedWalletRepository.findAll();
    }
}
