package com.jz.crm.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.crm.config.ContextProperties;
import com.jz.crm.store.KvBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Short-term dialogue window per customer address: LIST + JSON + trim + sliding TTL.
 * Key looks like {keyPrefix}{address}, e.g. context:5553999990000
 * <p>
 * Losing it only costs the classifier its short memory, so storage errors are
 * logged and swallowed: reads return an empty window and writes become no-ops.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextStore {

    private final KvBackend backend;
    private final ObjectMapper mapper;
    private final ContextProperties props;

    private String k(String address) { return props.getKeyPrefix() + address; }

    public void append(String address, String role, String content) {
        if (!StringUtils.hasText(address)) return;
        try {
            String json = mapper.writeValueAsString(new ContextTurn(role, content == null ? "" : content));
            backend.appendBounded(k(address), json, props.getMaxMessages(), props.getTtl());
        } catch (Exception e) {
            log.warn("[Context] append failed, address={}, err={}", address, e.getMessage());
        }
    }

    /** Oldest first. Empty when expired, absent or unreadable. */
    public List<ContextTurn> read(String address) {
        if (!StringUtils.hasText(address)) return List.of();
        List<String> raw;
        try {
            raw = backend.range(k(address));
        } catch (Exception e) {
            log.warn("[Context] read failed, address={}, err={}", address, e.getMessage());
            return List.of();
        }
        List<ContextTurn> out = new ArrayList<>(raw.size());
        for (String j : raw) {
            try {
                out.add(mapper.readValue(j, ContextTurn.class));
            } catch (Exception e) {
                log.warn("[Context] bad json ignored: {}", e.getMessage());
            }
        }
        return out;
    }

    public void clear(String address) {
        if (!StringUtils.hasText(address)) return;
        try {
            backend.delete(k(address));
        } catch (Exception e) {
            log.warn("[Context] clear failed, address={}, err={}", address, e.getMessage());
        }
    }
}
