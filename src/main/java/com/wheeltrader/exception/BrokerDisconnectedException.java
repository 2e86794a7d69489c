package com.wheeltrader.exception;

/**
 * Thrown when the broker gateway is not connected. The evaluation loop answers it by holding
 * every slot until connectivity returns.
 */
public class BrokerDisconnectedException extends BaseException {

    public BrokerDisconnectedException(String message) {
        super(ErrorCode.BROKER_DISCONNECTED, message);
    }

    public BrokerDisconnectedException(String message, Throwable cause) {
        super(ErrorCode.BROKER_DISCONNECTED, message, cause);
    }
}
