package com.marketintel.router.model;

public record AreaScore(String area, double score) {}
