package com.wheeltrader.core.engine;

import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.enums.PositionStatus;
import com.wheeltrader.domain.model.OptionContract;
import com.wheeltrader.domain.model.SlotSnapshot;
import com.wheeltrader.domain.model.WheelPosition;
import java.math.BigDecimal;
import java.util.List;

/**
 * Cash and share coverage still free for new short legs within one decision batch.
 *
 * <p>Starts from the account less everything live legs already commit (strike x multiplier
 * per short put, one round lot per short call) and shrinks as the batch takes contracts. A
 * roll may reuse what its own leg releases when the replacement is on the same side.
 */
class ExposureBudget {

    private final BigDecimal multiplier;
    private BigDecimal availableCash;
    private long availableCalls;
    private long livePuts;
    private long liveCalls;

    private BigDecimal cashCommitted = BigDecimal.ZERO;
    private int callsCommitted;

    ExposureBudget(BigDecimal cash, long sharesHeld, int contractMultiplier, List<SlotSnapshot> slots) {
        this.multiplier = BigDecimal.valueOf(contractMultiplier);
        BigDecimal committedCash = BigDecimal.ZERO;
        long committedCalls = 0;
        for (SlotSnapshot slot : slots) {
            WheelPosition leg = slot.getPosition();
            if (leg == null || !leg.isLive() || leg.getSide() == null) {
                continue;
            }
            if (leg.getStatus() == PositionStatus.PENDING_OPEN && leg.getContractId() == null) {
                // lost the opening half of a roll; reopened below as a fresh leg
                continue;
            }
            if (leg.getSide() == OptionSide.PUT) {
                livePuts++;
                if (leg.getStrike() != null) {
                    committedCash = committedCash.add(leg.getStrike().multiply(multiplier));
                }
            } else {
                liveCalls++;
                committedCalls++;
            }
        }
        this.availableCash = (cash != null ? cash : BigDecimal.ZERO).subtract(committedCash);
        this.availableCalls = sharesHeld / contractMultiplier - committedCalls;
    }

    /**
     * Commits coverage for a contract if there is enough of it.
     *
     * @param releasing the leg this contract replaces, or null for a fresh open
     * @return false, leaving the budget untouched, when the contract cannot be covered
     */
    boolean tryReserve(OptionContract contract, WheelPosition releasing) {
        boolean sameSide = releasing != null && releasing.getSide() == contract.getSide();
        if (contract.getSide() == OptionSide.PUT) {
            BigDecimal released = sameSide && releasing.getStrike() != null
                    ? releasing.getStrike().multiply(multiplier)
                    : BigDecimal.ZERO;
            BigDecimal needed = contract.getStrike().multiply(multiplier);
            BigDecimal free = availableCash.add(released);
            if (needed.compareTo(free) > 0) {
                return false;
            }
            availableCash = free.subtract(needed);
            cashCommitted = cashCommitted.add(needed);
            if (!sameSide) {
                livePuts++;
            }
        } else {
            long free = availableCalls + (sameSide ? 1 : 0);
            if (free < 1) {
                return false;
            }
            availableCalls = free - 1;
            callsCommitted++;
            if (!sameSide) {
                liveCalls++;
            }
        }
        return true;
    }

    /** Side with fewer live legs, counting this batch; PUT on a tie. */
    OptionSide underweightSide() {
        return liveCalls < livePuts ? OptionSide.CALL : OptionSide.PUT;
    }

    BigDecimal getAvailableCash() {
        return availableCash;
    }

    long getAvailableCalls() {
        return availableCalls;
    }

    BigDecimal getCashCommitted() {
        return cashCommitted;
    }

    int getCallsCommitted() {
        return callsCommitted;
    }
}
