package com.furniture.workshop.service;

import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.dto.WorkerAvailability;

/** Answers whether a worker may start production work right now. */
public interface AttendanceService {

    WorkerAvailability canWorkerStart(TenantContext ctx, String workerId);
}
