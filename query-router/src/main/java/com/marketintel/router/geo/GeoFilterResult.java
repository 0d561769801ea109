package com.marketintel.router.geo;

import java.util.List;
import java.util.Map;

/**
 * @param entities        canonical names of the places found in the query, in query order
 * @param filteredRecords records belonging to those places, or all records when none were found
 * @param totalRecords    record count before filtering
 */
public record GeoFilterResult(List<String> entities, List<Map<String, Object>> filteredRecords, int totalRecords) {

    public boolean isFiltered() {
        return !entities.isEmpty();
    }
}
