package com.signalrelay.idempotency;

import com.signalrelay.domain.model.SignalEvent;
import com.signalrelay.webhook.WebhookConfig;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Suppresses repeated alerts for the same (ticker, signal, time) within a TTL window.
 *
 * <p>Each entry maps an idempotency key to its expiry instant; there is no payload.
 * {@link #admit(String)} does check-and-insert inside a single
 * {@link ConcurrentHashMap#compute} call, so two concurrent requests carrying the same
 * key cannot both be admitted.
 *
 * <p>Expired entries are replaced in place when their key is seen again, and reclaimed
 * otherwise by {@link #sweepExpired()}. A failed sweep only delays reclamation.
 *
 * <p>Key schema: first 16 hex chars of {@code sha256(ticker|signal|instant)}.
 */
@Component
public class IdempotencyCache {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyCache.class);

    /** Hash bytes kept in a key; 8 bytes render as 16 hex characters. */
    private static final int KEY_BYTES = 8;

    private final Map<String, Instant> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public IdempotencyCache(WebhookConfig webhookConfig, Clock clock) {
        this(webhookConfig.getIdempotencyTtl(), clock);
    }

    public IdempotencyCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Idempotency TTL must be positive: " + ttl);
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Admits {@code key} if it is absent or expired, recording a fresh expiry of now + TTL.
     *
     * @return true if admitted, false if the key was admitted within the last TTL (duplicate)
     */
    public boolean admit(String key) {
        Instant now = clock.instant();
        AtomicBoolean admitted = new AtomicBoolean(false);
        entries.compute(key, (k, expiry) -> {
            if (expiry != null && now.isBefore(expiry)) {
                return expiry;
            }
            admitted.set(true);
            return now.plus(ttl);
        });
        if (!admitted.get()) {
            log.debug("Duplicate idempotency key: {}", key);
        }
        return admitted.get();
    }

    /**
     * Withdraws an admission. Used when the event could not be handed to the delivery
     * queue, so the sender's retry is not mistaken for a duplicate.
     */
    public void release(String key) {
        entries.remove(key);
    }

    /**
     * Removes every entry whose expiry has passed. An entry re-admitted while the sweep
     * runs carries a new expiry and is left alone. Runs every
     * {@code relay.webhook.cache-sweep-interval}.
     */
    @Scheduled(fixedDelayString = "${relay.webhook.cache-sweep-interval:PT1M}")
    public void sweepExpired() {
        try {
            Instant now = clock.instant();
            int removed = 0;
            for (Map.Entry<String, Instant> entry : entries.entrySet()) {
                if (!now.isBefore(entry.getValue()) && entries.remove(entry.getKey(), entry.getValue())) {
                    removed++;
                }
            }
            if (removed > 0) {
                log.debug("Idempotency sweep removed {} expired entries, {} remaining", removed, entries.size());
            }
        } catch (RuntimeException e) {
            log.warn("Idempotency sweep failed, expired entries stay until next sweep", e);
        }
    }

    /**
     * Derives the idempotency key for an event. The time component is the parsed instant,
     * so two spellings of the same moment produce the same key.
     */
    public String keyFor(SignalEvent event) {
        String raw = String.join(
                "|",
                event.getTicker(),
                event.getSignal().getLabel(),
                event.getTimestamp().toString());
        return shortDigest(raw);
    }

    /** Number of tracked keys, expired-but-unswept included. */
    public int size() {
        return entries.size();
    }

    /** 64-bit key: collisions are negligible for the few thousand keys one window holds. */
    private static String shortDigest(String raw) {
        MessageDigest sha256;
        try {
            sha256 = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] hash = sha256.digest(raw.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(hash, 0, KEY_BYTES);
    }
}
