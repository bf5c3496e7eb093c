package com.example.datarecovery.audit;

import com.example.datarecovery.store.CollectionStore;
import com.example.datarecovery.store.StoreCollection;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Appends audit events to the {@code auditLogs} collection of the record store.
 * Top-level detail fields holding secrets are redacted before they are written.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoreAuditSink implements AuditSink {

    static final Set<String> SENSITIVE_FIELDS = Set.of("password", "ssn", "bankAccount");
    static final String REDACTED = "***REDACTED***";

    private final CollectionStore store;
    private final ObjectMapper objectMapper;

    @Override
    public void logAudit(AuditEvent event) {
        ObjectNode entry = objectMapper.createObjectNode();
        entry.put("id", UUID.randomUUID().toString());
        entry.put("timestamp", event.getTimestamp().toString());
        entry.put("userId", event.getUserId());
        entry.put("action", event.getAction());
        entry.put("resource", event.getResource());
        entry.set("details", objectMapper.valueToTree(sanitize(event.getDetails())));
        entry.put("ip", event.getIp());
        entry.put("userAgent", event.getUserAgent());

        store.bulkInsert(StoreCollection.AUDIT_LOGS, List.of(entry));
        log.debug("Recorded audit event {} on {} by {}", event.getAction(), event.getResource(), event.getUserId());
    }

    static Map<String, Object> sanitize(Map<String, Object> details) {
        if (details == null) {
            return Map.of();
        }
        Map<String, Object> sanitized = new LinkedHashMap<>(details);
        for (String field : SENSITIVE_FIELDS) {
            if (sanitized.containsKey(field)) {
                sanitized.put(field, REDACTED);
            }
        }
        return sanitized;
    }
}
