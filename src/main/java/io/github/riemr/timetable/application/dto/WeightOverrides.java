package io.github.riemr.timetable.application.dto;

/** ソフト制約の重みの上書き（null の項目は既定値を使用） */
public record WeightOverrides(
    Double gap,
    Double balance,
    Double early,
    Double late,
    Double roomDistance
) {
}
