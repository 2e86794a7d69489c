package com.wheeltrader.domain.model;

import com.wheeltrader.domain.enums.RollAction;
import com.wheeltrader.domain.enums.RollReason;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Engine output for one slot in one cycle. Ephemeral: consumed by the order lifecycle
 * manager in the same cycle.
 *
 * <p>{@code targetContract} is set for OPEN and ROLL; {@code currentContractId} for ROLL
 * and CLOSE. {@code context} holds the snapshot values the decision was made from.
 */
@Value
@Builder
public class RollDecision {

    int slotId;
    RollAction action;
    RollReason reason;
    String currentContractId;
    TargetContract targetContract;
    Map<String, Object> context;

    public static RollDecision hold(int slotId, RollReason reason, Map<String, Object> context) {
        return RollDecision.builder()
                .slotId(slotId)
                .action(RollAction.HOLD)
                .reason(reason)
                .context(context)
                .build();
    }

    public boolean isHold() {
        return action == RollAction.HOLD;
    }
}
