package com.agenthub.context.service;

import com.agenthub.context.constant.ContextConstants;
import com.agenthub.context.model.AccessIntent;
import com.agenthub.context.model.ContextEntry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 鉴权拒绝审计
 * 独立 Logger，便于单独落盘或采集
 */
@Component
public class AccessAuditLogger {

    private static final Logger audit = LoggerFactory.getLogger(ContextConstants.AUDIT_LOGGER);

    private final MeterRegistry meterRegistry;

    public AccessAuditLogger(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void denied(String agent, ContextEntry entry, AccessIntent intent, String operation) {
        audit.warn("Access denied: agent={}, fullKey={}, intent={}, operation={}, accessLevel={}, dataType={}, owner={}",
            agent, entry.getId(), intent, operation, entry.getAccessLevel(), entry.getDataType(), entry.getOwnerAgent());
        meterRegistry.counter("context.access.denied",
            "intent", intent.name().toLowerCase(),
            "operation", operation).increment();
    }
}
