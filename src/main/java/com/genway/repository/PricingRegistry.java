package com.genway.repository;

import com.genway.model.PricingEntry;

import java.util.List;
import java.util.Optional;

/**
 * Read-only pricing catalogue.
 */
public interface PricingRegistry {

    /**
     * Look up by model id or by the provider-side model name.
     */
    Optional<PricingEntry> find(String model);

    List<PricingEntry> findByProvider(String provider);
}
