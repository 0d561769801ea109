package com.marketintel.router.routing;

public record FieldMatch(String field, String description) {}
