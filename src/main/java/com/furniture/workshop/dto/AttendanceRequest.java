package com.furniture.workshop.dto;

import com.furniture.workshop.model.AttendanceStatus;

import java.time.LocalDate;

public record AttendanceRequest(LocalDate workDate, AttendanceStatus status, String note) {
}
