package com.wheeltrader.event;

import com.wheeltrader.domain.model.DecisionRecord;
import org.springframework.context.ApplicationEvent;

/** Published by the {@code DecisionLogger} for every record it logs. */
public class DecisionLogEvent extends ApplicationEvent {

    private final DecisionRecord decisionRecord;

    public DecisionLogEvent(Object source, DecisionRecord decisionRecord) {
        super(source);
        this.decisionRecord = decisionRecord;
    }

    public DecisionRecord getDecisionRecord() {
        return decisionRecord;
    }
}
