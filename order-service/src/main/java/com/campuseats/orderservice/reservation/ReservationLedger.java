package com.campuseats.orderservice.reservation;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory table of short-lived inventory claims.
 *
 * <p>Keys are spread over a fixed set of lock stripes. An acquire call locks every stripe its
 * keys fall into, always in ascending stripe order, checks all keys and only then writes the
 * claims, so a call either claims its whole set or nothing. Calls on disjoint stripes never
 * wait on each other.
 *
 * <p>Claims expire after their TTL. Expired claims are dropped lazily whenever their key is
 * touched and in bulk by {@link #evictExpired()}.
 */
@Slf4j
public class ReservationLedger {

    private final Clock clock;
    private final ReentrantLock[] stripes;
    // key -> (holder -> claim); guarded by the key's stripe
    private final Map<ReservationKey, Map<String, Reservation>> claims = new ConcurrentHashMap<>();

    public ReservationLedger(Clock clock, int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive: " + stripeCount);
        }
        this.clock = clock;
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public ReservationResult acquire(Collection<ReservationRequest> requests, String holder, Duration ttl) {
        if (requests.isEmpty()) {
            throw new IllegalArgumentException("Nothing to reserve");
        }
        Map<ReservationKey, ReservationRequest> merged = new LinkedHashMap<>();
        for (ReservationRequest request : requests) {
            merged.merge(request.getKey(), request, ReservationRequest::plus);
        }

        TreeSet<Integer> stripeIndexes = stripesOf(merged.keySet());
        lockAll(stripeIndexes);
        try {
            Instant now = clock.instant();
            List<ReservationKey> conflicts = new ArrayList<>();
            for (ReservationRequest request : merged.values()) {
                if (!fits(request, holder, now)) {
                    conflicts.add(request.getKey());
                }
            }
            if (!conflicts.isEmpty()) {
                log.debug("Reservation conflict: holder={}, keys={}", holder, conflicts);
                return ReservationResult.conflict(conflicts);
            }

            Instant expiresAt = now.plus(ttl);
            for (ReservationRequest request : merged.values()) {
                claims.computeIfAbsent(request.getKey(), k -> new LinkedHashMap<>())
                        .put(holder, new Reservation(request.getKey(), holder, request.getQuantity(),
                                request.isExclusive(), now, expiresAt));
            }
            log.debug("Reservations granted: holder={}, keys={}, expiresAt={}", holder, merged.keySet(), expiresAt);
            return ReservationResult.granted(expiresAt);
        } finally {
            unlockAll(stripeIndexes);
        }
    }

    public ReleaseResult release(Collection<ReservationKey> keys, String holder) {
        List<ReservationKey> released = new ArrayList<>();
        List<ReservationKey> notFound = new ArrayList<>();
        Instant now = clock.instant();

        for (ReservationKey key : keys) {
            ReentrantLock lock = stripes[stripeOf(key)];
            lock.lock();
            try {
                Map<String, Reservation> holders = liveHolders(key, now);
                if (holders != null && holders.remove(holder) != null) {
                    released.add(key);
                    if (holders.isEmpty()) {
                        claims.remove(key);
                    }
                } else {
                    notFound.add(key);
                }
            } finally {
                lock.unlock();
            }
        }
        return new ReleaseResult(released, notFound);
    }

    /**
     * Drops every claim of one holder, whatever the key. Used when the keys the holder
     * reserved are no longer known, e.g. its order row is already gone.
     */
    public List<ReservationKey> releaseAllHeldBy(String holder) {
        List<ReservationKey> released = new ArrayList<>();
        for (ReservationKey key : new ArrayList<>(claims.keySet())) {
            ReentrantLock lock = stripes[stripeOf(key)];
            lock.lock();
            try {
                Map<String, Reservation> holders = claims.get(key);
                if (holders != null && holders.remove(holder) != null) {
                    released.add(key);
                    if (holders.isEmpty()) {
                        claims.remove(key);
                    }
                }
            } finally {
                lock.unlock();
            }
        }
        return released;
    }

    public Optional<String> isHeld(ReservationKey key) {
        ReentrantLock lock = stripes[stripeOf(key)];
        lock.lock();
        try {
            Map<String, Reservation> holders = liveHolders(key, clock.instant());
            if (holders == null || holders.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(holders.keySet().iterator().next());
        } finally {
            lock.unlock();
        }
    }

    public List<Reservation> listForItem(UUID itemId) {
        Instant now = clock.instant();
        List<Reservation> result = new ArrayList<>();
        for (ReservationKey key : new ArrayList<>(claims.keySet())) {
            if (!key.getItemId().equals(itemId)) {
                continue;
            }
            ReentrantLock lock = stripes[stripeOf(key)];
            lock.lock();
            try {
                Map<String, Reservation> holders = liveHolders(key, now);
                if (holders != null) {
                    result.addAll(holders.values());
                }
            } finally {
                lock.unlock();
            }
        }
        return result;
    }

    /**
     * @return number of claims removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int evicted = 0;
        for (ReservationKey key : new ArrayList<>(claims.keySet())) {
            ReentrantLock lock = stripes[stripeOf(key)];
            lock.lock();
            try {
                evicted += evictExpired(key, now);
            } finally {
                lock.unlock();
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} expired reservations", evicted);
        }
        return evicted;
    }

    public ReservationStats stats() {
        Instant now = clock.instant();
        List<Reservation> snapshot = new ArrayList<>();
        int keys = 0;
        int expired = 0;
        for (ReservationKey key : new ArrayList<>(claims.keySet())) {
            ReentrantLock lock = stripes[stripeOf(key)];
            lock.lock();
            try {
                Map<String, Reservation> holders = claims.get(key);
                if (holders == null) {
                    continue;
                }
                boolean live = false;
                for (Reservation reservation : holders.values()) {
                    if (reservation.isExpired(now)) {
                        expired++;
                    } else {
                        snapshot.add(reservation);
                        live = true;
                    }
                }
                // a key whose claims have all lapsed is free, even before eviction
                if (live) {
                    keys++;
                }
            } finally {
                lock.unlock();
            }
        }
        return new ReservationStats(keys, snapshot.size(), expired, snapshot);
    }

    /**
     * Drops every claim. Incident response only: orders still pending lose their hold on stock.
     *
     * @return number of claims removed
     */
    public int clearAll() {
        TreeSet<Integer> all = new TreeSet<>();
        for (int i = 0; i < stripes.length; i++) {
            all.add(i);
        }
        lockAll(all);
        try {
            int removed = claims.values().stream().mapToInt(Map::size).sum();
            claims.clear();
            log.warn("Reservation ledger cleared: {} claims dropped", removed);
            return removed;
        } finally {
            unlockAll(all);
        }
    }

    private boolean fits(ReservationRequest request, String holder, Instant now) {
        Map<String, Reservation> holders = liveHolders(request.getKey(), now);
        if (holders == null || holders.isEmpty()) {
            return request.isExclusive() || request.getQuantity() <= request.getOnHand();
        }
        if (request.isExclusive()) {
            // re-acquiring our own key refreshes it
            return holders.size() == 1 && holders.containsKey(holder);
        }
        int heldByOthers = 0;
        for (Reservation reservation : holders.values()) {
            if (reservation.getHolder().equals(holder)) {
                continue;
            }
            if (reservation.isExclusive()) {
                return false;
            }
            heldByOthers += reservation.getQuantity();
        }
        return heldByOthers + request.getQuantity() <= request.getOnHand();
    }

    // caller holds the key's stripe
    private Map<String, Reservation> liveHolders(ReservationKey key, Instant now) {
        evictExpired(key, now);
        return claims.get(key);
    }

    // caller holds the key's stripe
    private int evictExpired(ReservationKey key, Instant now) {
        Map<String, Reservation> holders = claims.get(key);
        if (holders == null) {
            return 0;
        }
        int evicted = 0;
        Iterator<Reservation> it = holders.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                evicted++;
            }
        }
        if (holders.isEmpty()) {
            claims.remove(key);
        }
        return evicted;
    }

    private TreeSet<Integer> stripesOf(Collection<ReservationKey> keys) {
        TreeSet<Integer> indexes = new TreeSet<>();
        for (ReservationKey key : keys) {
            indexes.add(stripeOf(key));
        }
        return indexes;
    }

    private int stripeOf(ReservationKey key) {
        return Math.floorMod(key.hashCode(), stripes.length);
    }

    private void lockAll(TreeSet<Integer> indexes) {
        for (Integer index : indexes) {
            stripes[index].lock();
        }
    }

    private void unlockAll(TreeSet<Integer> indexes) {
        for (Integer index : indexes.descendingSet()) {
            stripes[index].unlock();
        }
    }
}
