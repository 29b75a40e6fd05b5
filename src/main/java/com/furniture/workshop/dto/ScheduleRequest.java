package com.furniture.workshop.dto;

import java.time.LocalDate;

public record ScheduleRequest(LocalDate plannedStartDate, LocalDate plannedEndDate) {
}
