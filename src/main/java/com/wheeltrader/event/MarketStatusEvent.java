package com.wheeltrader.event;

import com.wheeltrader.domain.enums.MarketPhase;
import org.springframework.context.ApplicationEvent;

/** Published by the trading calendar when the market moves between phases. */
public class MarketStatusEvent extends ApplicationEvent {

    private final MarketPhase previousPhase;
    private final MarketPhase currentPhase;

    public MarketStatusEvent(Object source, MarketPhase previousPhase, MarketPhase currentPhase) {
        super(source);
        this.previousPhase = previousPhase;
        this.currentPhase = currentPhase;
    }

    public MarketPhase getPreviousPhase() {
        return previousPhase;
    }

    public MarketPhase getCurrentPhase() {
        return currentPhase;
    }
}
