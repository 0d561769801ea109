package com.marketintel.router.model;

public enum ResultStatus {
    /** Records were produced for the routed endpoint. */
    COMPLETE,
    /** The endpoint has data but the geographic selection matched none of it. */
    NO_DATA_FOR_SELECTION,
    /** The query needs results merged across endpoints; nothing was processed. */
    MULTI_ENDPOINT_REQUIRED
}
