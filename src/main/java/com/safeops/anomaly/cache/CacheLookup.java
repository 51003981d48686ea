package com.safeops.anomaly.cache;

/**
 * @param reused true when a fresh resident entry was returned without training
 */
public record CacheLookup(CachedModels models, boolean reused) {}
