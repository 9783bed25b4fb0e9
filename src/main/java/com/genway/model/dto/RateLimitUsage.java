package com.genway.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current window counters for one (provider, model, caller).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitUsage {
    private String provider;
    private String model;
    private String callerId;
    private long requestsThisMinute;
    private long tokensThisMinute;
    private long requestsToday;
}
