package com.wheeltrader.domain.enums;

/** Connectivity of the broker gateway as tracked by the connection monitor. */
public enum BrokerConnectionState {
    CONNECTED,
    DEGRADED,
    DISCONNECTED
}
