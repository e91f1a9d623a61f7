package com.metricore.service.core.store;

import com.metricore.metric.error.MetricsEngineException;

/** Identity of the party inserting a batch; fills the auto-primary tag of points that lack it. */
public record IngestContext(String sourceIdentity) {

    public IngestContext {
        if (sourceIdentity == null || sourceIdentity.isBlank()) {
            throw MetricsEngineException.invalidArgument("Source identity must not be blank");
        }
    }

    public static IngestContext of(String sourceIdentity) {
        return new IngestContext(sourceIdentity);
    }
}
