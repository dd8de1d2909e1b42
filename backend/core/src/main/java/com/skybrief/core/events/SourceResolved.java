package com.skybrief.core.events;

import com.skybrief.core.model.Domain;
import com.skybrief.core.model.FailureReason;
import com.skybrief.core.model.Provenance;

import java.time.Instant;

public record SourceResolved(
        Instant timestamp,
        Domain domain,
        Provenance provenance,
        FailureReason reason,
        String detail,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SourceResolved";
    }
}
