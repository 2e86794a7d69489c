package com.wheeltrader.event;

import com.wheeltrader.domain.model.WheelAlert;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every reportable condition. Metrics count these by condition; anything
 * that wants to page an operator on INVARIANT_VIOLATION listens here.
 */
public class WheelAlertEvent extends ApplicationEvent {

    private final WheelAlert alert;

    public WheelAlertEvent(Object source, WheelAlert alert) {
        super(source);
        this.alert = alert;
    }

    public WheelAlert getAlert() {
        return alert;
    }
}
