package com.marketintel.router.data;

import com.marketintel.router.config.QueryRouterProperties;
import com.marketintel.router.model.RawDataset;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.Optional;

/**
 * Fetches endpoint datasets from remote blob storage over HTTP.
 *
 * URL resolution: an explicit entry in query-router.blob.urls wins, otherwise
 * {baseUrl}/{cacheKey}.json. A 404 means the blob store does not hold the key.
 * Connection failures and 5xx responses are retried by Resilience4j.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BlobDatasetSource implements DatasetSource {

    private final RestTemplate restTemplate;
    private final RawDatasetParser parser;
    private final QueryRouterProperties properties;

    @Override
    @Retry(name = "datasetBlob")
    public Optional<RawDataset> fetch(String cacheKey) throws IOException {
        String url = urlFor(cacheKey);
        if (url == null) {
            return Optional.empty();
        }

        log.debug("Fetching blob: {}", url);
        try {
            String body = restTemplate.getForObject(url, String.class);
            if (body == null || body.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(parser.parse(body));

        } catch (HttpClientErrorException.NotFound e) {
            log.debug("No blob (404) for URL: {}", url);
            return Optional.empty();
        }
    }

    @Override
    public String describe(String cacheKey) {
        String url = urlFor(cacheKey);
        return url == null ? "blob (no URL configured)" : "blob " + url;
    }

    public boolean isEnabled() {
        return properties.getBlob().isEnabled();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    String urlFor(String cacheKey) {
        QueryRouterProperties.Blob blob = properties.getBlob();
        String explicit = blob.getUrls().get(cacheKey);
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        String base = blob.getBaseUrl();
        if (base == null || base.isBlank()) {
            return null;
        }
        return (base.endsWith("/") ? base : base + "/") + cacheKey + ".json";
    }
}
