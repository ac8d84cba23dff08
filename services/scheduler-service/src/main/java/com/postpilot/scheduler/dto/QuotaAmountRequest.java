package com.postpilot.scheduler.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuotaAmountRequest {
    private Long amount = 1L;

    // periodId from the reserve response; absent means the current period
    private String periodId;
}
