package com.marketintel.router.data;

import java.util.List;

/**
 * @param loadedKeys   keys held in memory
 * @param loadingKeys  keys with a load in progress
 * @param totalRecords records held across all loaded datasets
 */
public record CacheStatus(List<String> loadedKeys, List<String> loadingKeys, int totalRecords) {}
