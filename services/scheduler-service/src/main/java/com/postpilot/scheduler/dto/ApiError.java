package com.postpilot.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.postpilot.scheduler.quota.QuotaDecision;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    private String code;
    private String message;
    /** Present on quota rejections. */
    private QuotaDecision quota;
}
