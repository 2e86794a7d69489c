package com.wheeltrader.event;

import com.wheeltrader.domain.model.CycleOutcome;
import java.time.Duration;
import org.springframework.context.ApplicationEvent;

/** Published by the cycle runner after a decision batch has been logged and dispatched. */
public class CycleCompletedEvent extends ApplicationEvent {

    private final CycleOutcome outcome;
    private final Duration elapsed;

    public CycleCompletedEvent(Object source, CycleOutcome outcome, Duration elapsed) {
        super(source);
        this.outcome = outcome;
        this.elapsed = elapsed;
    }

    public CycleOutcome getOutcome() {
        return outcome;
    }

    public Duration getElapsed() {
        return elapsed;
    }
}
