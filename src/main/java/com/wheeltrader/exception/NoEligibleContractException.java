package com.wheeltrader.exception;

import java.time.LocalDate;
import java.util.Map;
import lombok.Getter;

/** No contract survived chain filtering for a slot. Recoverable: the slot is retried next cycle. */
@Getter
public class NoEligibleContractException extends BaseException {

    private final int slotId;

    public NoEligibleContractException(int slotId, LocalDate targetExpiration, String reason) {
        super(
                ErrorCode.NO_ELIGIBLE_CONTRACT,
                String.format("No eligible contract for slot %d (target %s): %s", slotId, targetExpiration, reason),
                Map.of("slotId", slotId, "targetExpiration", String.valueOf(targetExpiration), "reason", reason));
        this.slotId = slotId;
    }
}
