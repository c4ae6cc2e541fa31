package io.github.riemr.timetable.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Room {
    String id;
    RoomType type;
    int capacity;
}
