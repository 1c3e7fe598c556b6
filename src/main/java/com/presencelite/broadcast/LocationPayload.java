package com.presencelite.broadcast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.presencelite.model.Commitment;
import com.presencelite.model.SpeedCategory;

import java.util.List;

/**
 * One precision level per trust tier; each receiver reads only the level
 * its own tier for the sender entitles it to.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocationPayload(
    Commitment commitment,
    List<PrecisionLevel> precisionLevels,
    boolean moving,
    Double heading,
    SpeedCategory speedCategory
) implements BroadcastPayload {

    public LocationPayload {
        precisionLevels = precisionLevels == null ? null : List.copyOf(precisionLevels);
    }

    @Override
    public BroadcastType broadcastType() {
        return BroadcastType.LOCATION;
    }
}
