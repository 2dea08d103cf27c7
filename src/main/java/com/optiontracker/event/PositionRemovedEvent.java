package com.optiontracker.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published by the PositionBook after a position has left the book. Listeners drop any
 * per-position state they hold for it.
 */
public class PositionRemovedEvent extends ApplicationEvent {

    private final String positionId;

    public PositionRemovedEvent(Object source, String positionId) {
        super(source);
        this.positionId = positionId;
    }

    public String getPositionId() {
        return positionId;
    }
}
