package com.genway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Cache entry value.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CachedResponse implements Serializable {

    private static final long serialVersionUID = 1L;

    private String content;

    private Usage usage;

    private BigDecimal cost;

    private Map<String, Object> meta;

    /**
     * Provider that produced the entry.
     */
    private String provider;

    /**
     * Model that produced the entry.
     */
    private String model;

    /**
     * When this entry was created.
     */
    private Instant createdAt;
}
