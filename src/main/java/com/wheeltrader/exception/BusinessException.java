package com.wheeltrader.exception;

import java.util.Map;

/** A request that is well formed but not allowed in the slot's current state. */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.SLOT_STATE_CONFLICT, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    /** Conflict carrying the slot and the control state that refused the request. */
    public static BusinessException slotConflict(int slotId, Object control, String message) {
        return new BusinessException(
                ErrorCode.SLOT_STATE_CONFLICT, message, Map.of("slotId", slotId, "control", String.valueOf(control)));
    }
}
