package com.marketintel.router.processing;

import com.marketintel.router.catalog.EndpointDefinition;

import java.util.List;

/**
 * Per-query inputs a processor may need besides the dataset.
 *
 * @param extractedBrands brand concept names named in the query, in query order
 */
public record ProcessingContext(EndpointDefinition endpoint, String query, List<String> extractedBrands) {

    public static ProcessingContext of(EndpointDefinition endpoint) {
        return new ProcessingContext(endpoint, "", List.of());
    }
}
