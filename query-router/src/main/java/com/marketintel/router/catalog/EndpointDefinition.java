package com.marketintel.router.catalog;

/**
 * @param path           endpoint identifier as used by callers, e.g. "/competitive-analysis"
 * @param cacheKey       storage key of the pre-computed dataset; aliases share a key
 * @param targetVariable raw field holding the endpoint's primary metric
 * @param type           result type label handed to the rendering layer
 */
public record EndpointDefinition(String path, String cacheKey, String targetVariable, String type) {}
