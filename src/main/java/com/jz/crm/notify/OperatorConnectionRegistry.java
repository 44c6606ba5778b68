package com.jz.crm.notify;

import com.jz.crm.store.KvBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live operator connections: one channel per operator id, operators grouped by sector.
 * The online set is mirrored into the key/value store so other nodes can read it.
 * A channel that fails on send is dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperatorConnectionRegistry {

    static final String ONLINE_KEY = "online_operators";

    private final KvBackend backend;

    private final Map<Long, OperatorChannel> channels = new ConcurrentHashMap<>();
    private final Map<Long, String> sectorOf = new ConcurrentHashMap<>();
    private final Map<String, Set<Long>> bySector = new ConcurrentHashMap<>();

    public void register(Long operatorId, String sector, OperatorChannel channel) {
        OperatorChannel prev = channels.put(operatorId, channel);
        String prevSector = sectorOf.put(operatorId, sector);
        if (prevSector != null && !prevSector.equals(sector)) {
            Set<Long> old = bySector.get(prevSector);
            if (old != null) old.remove(operatorId);
        }
        bySector.computeIfAbsent(sector, s -> ConcurrentHashMap.newKeySet()).add(operatorId);
        try {
            backend.setAdd(ONLINE_KEY, String.valueOf(operatorId));
        } catch (Exception e) {
            log.warn("[WS] online mark failed, operator={}, err={}", operatorId, e.getMessage());
        }
        log.info("[WS] operator {} connected, sector={}, replaced={}", operatorId, sector, prev != null);
    }

    public void unregister(Long operatorId, String sector) {
        channels.remove(operatorId);
        sectorOf.remove(operatorId, sector);
        Set<Long> members = bySector.get(sector);
        if (members != null) members.remove(operatorId);
        try {
            backend.setRemove(ONLINE_KEY, String.valueOf(operatorId));
        } catch (Exception e) {
            log.warn("[WS] online unmark failed, operator={}, err={}", operatorId, e.getMessage());
        }
        log.info("[WS] operator {} disconnected", operatorId);
    }

    /**
     * Drops the registration only while {@code channel} is still the current one, so a
     * late close of a replaced connection doesn't evict its successor.
     */
    public void unregister(Long operatorId, String sector, OperatorChannel channel) {
        if (channels.get(operatorId) == channel) {
            unregister(operatorId, sector);
        }
    }

    /** @return whether the payload was handed to an open channel */
    public boolean sendTo(Long operatorId, String payload) {
        OperatorChannel ch = channels.get(operatorId);
        if (ch == null) return false;
        if (!ch.isOpen()) {
            drop(operatorId);
            return false;
        }
        try {
            ch.send(payload);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("[WS] send failed, operator={}, err={}", operatorId, e.getMessage());
            drop(operatorId);
            return false;
        }
    }

    /** @return number of operators reached */
    public int broadcastToSector(String sector, String payload) {
        Set<Long> members = bySector.get(sector);
        if (members == null) return 0;
        int n = 0;
        for (Long id : Set.copyOf(members)) {
            if (sendTo(id, payload)) n++;
        }
        return n;
    }

    public int broadcastAll(String payload) {
        int n = 0;
        for (Long id : Set.copyOf(channels.keySet())) {
            if (sendTo(id, payload)) n++;
        }
        return n;
    }

    public Set<String> onlineOperators() {
        try {
            return backend.setMembers(ONLINE_KEY);
        } catch (Exception e) {
            log.warn("[WS] online read failed, err={}", e.getMessage());
            return Set.of();
        }
    }

    public int connectedCount() {
        return channels.size();
    }

    private void drop(Long operatorId) {
        String sector = sectorOf.get(operatorId);
        if (sector != null) {
            unregister(operatorId, sector);
        } else {
            channels.remove(operatorId);
        }
    }
}
