package com.furniture.workshop.dto;

/** A worker already booked on another work order in an overlapping period. */
public record WorkerConflict(String workerId, String workerName, String workOrderId, String workOrderNumber) {
}
