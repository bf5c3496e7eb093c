package com.example.datarecovery.audit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One audit trail entry emitted by the recovery subsystem.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {

    public static final String INTERNAL_IP = "internal";
    public static final String SYSTEM_USER_AGENT = "system";

    private Instant timestamp;
    private String userId;
    private String action;
    private String resource;
    private Map<String, Object> details;
    private String ip;
    private String userAgent;
}
