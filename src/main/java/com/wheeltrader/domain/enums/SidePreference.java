package com.wheeltrader.domain.enums;

/** Which option side the rebalancer allows for new legs at the current allocation bias. */
public enum SidePreference {
    PUT,
    CALL,
    EITHER;

    public boolean permits(OptionSide side) {
        return this == EITHER || name().equals(side.name());
    }
}
