package com.furniture.workshop.lifecycle;

public enum WorkOrderEvent {
    SCHEDULE,
    UNSCHEDULE,
    START,
    COMPLETE
}
