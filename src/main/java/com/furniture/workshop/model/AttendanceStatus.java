package com.furniture.workshop.model;

public enum AttendanceStatus {
    PRESENT,
    FIELD_WORK,
    ABSENT,
    SICK_LEAVE,
    VACATION;

    public boolean isWorking() {
        return this == PRESENT || this == FIELD_WORK;
    }
}
