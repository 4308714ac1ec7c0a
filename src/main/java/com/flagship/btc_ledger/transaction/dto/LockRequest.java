package com.flagship.btc_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class LockRequest {

    @NotNull(message = "locked is required")
    Boolean locked;

    @JsonCreator
    public LockRequest(@JsonProperty("locked") Boolean locked) {
        this.locked = locked;
    }
}
