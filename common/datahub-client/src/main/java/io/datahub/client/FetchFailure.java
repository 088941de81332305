package io.datahub.client;

/**
 * Why a fetch did not produce a live payload.
 */
public enum FetchFailure {
    /** Connection refused, timeout or other I/O failure. */
    TRANSPORT,
    /** Token missing after refresh, or 401/403 beyond the retry bound. */
    AUTH,
    /** 200 with an empty or undecodable body. */
    EMPTY_PAYLOAD,
    /** Any other status code. */
    UPSTREAM
}
