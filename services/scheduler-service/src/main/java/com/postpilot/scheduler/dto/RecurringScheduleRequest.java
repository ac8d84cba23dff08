package com.postpilot.scheduler.dto;

import lombok.*;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecurringScheduleRequest {
    // rotated one occurrence at a time
    private List<UUID> contentPieceIds;
    private List<UUID> destinationAccountIds;
    private OffsetDateTime startAt;
    private RecurrenceFrequency frequency;
    // units of frequency between occurrences, 1 when absent
    private Integer interval;
    // exactly one of occurrences and until
    private Integer occurrences;
    private OffsetDateTime until;
}
