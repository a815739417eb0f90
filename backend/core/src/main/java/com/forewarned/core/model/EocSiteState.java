package com.forewarned.core.model;

import java.time.Instant;
import java.util.Objects;

public record EocSiteState(
        EocState state,
        boolean activated,
        Instant lastCheck,
        String description
) {
    public EocSiteState {
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(lastCheck, "lastCheck is required");
        description = description == null ? "" : description;
    }

    public static EocSiteState observed(EocState state, Instant lastCheck, String description) {
        return new EocSiteState(state, state != EocState.INACTIVE, lastCheck, description);
    }
}
