package com.furniture.workshop.dto;

public record WorkerAvailability(boolean allowed, String reason) {

    public static WorkerAvailability available() {
        return new WorkerAvailability(true, null);
    }

    public static WorkerAvailability unavailable(String reason) {
        return new WorkerAvailability(false, reason);
    }
}
