package com.milestake.api.oracle;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One participant's position in the result set. Serialized as the canonical
 * result entry {@code {address, correlationId, miles, confirmed}}.
 */
@JsonPropertyOrder({"address", "correlationId", "miles", "confirmed"})
public record ParticipantStanding(
        String address,
        String correlationId,
        @JsonIgnore int joinOrder,
        BigDecimal miles,
        boolean confirmed
) {

    public ParticipantStanding {
        miles = (miles == null ? BigDecimal.ZERO : miles).setScale(2, RoundingMode.HALF_UP);
    }
}
