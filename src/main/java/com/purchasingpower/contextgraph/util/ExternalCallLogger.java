package com.purchasingpower.contextgraph.util;

import com.purchasingpower.contextgraph.model.CallContext;
import com.purchasingpower.contextgraph.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging for calls to external collaborators (embedding service, graph files, sources).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }
}
