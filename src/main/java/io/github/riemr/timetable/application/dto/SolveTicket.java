package io.github.riemr.timetable.application.dto;

/** 非同期求解ジョブの制御チケット */
public record SolveTicket(String ticketId) {
}
