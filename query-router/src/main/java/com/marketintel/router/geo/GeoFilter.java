package com.marketintel.router.geo;

import java.util.List;
import java.util.Map;

/**
 * Resolves place names in a query and narrows raw records to those places.
 * Records are left untouched when the query names no known place.
 */
public interface GeoFilter {

    GeoFilterResult resolve(String query, List<Map<String, Object>> records);
}
