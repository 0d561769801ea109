package com.marketintel.router.data;

import com.marketintel.router.model.RawDataset;

import java.io.IOException;
import java.util.Optional;

/**
 * One place a pre-computed endpoint dataset may live.
 *
 * An empty result means "not here, try the next source". A thrown exception
 * means the source itself is broken (unreadable file, malformed document,
 * network failure); the cache logs it and moves on.
 */
public interface DatasetSource {

    Optional<RawDataset> fetch(String cacheKey) throws IOException;

    /** Location of the key in this source, used in diagnostics. */
    String describe(String cacheKey);
}
