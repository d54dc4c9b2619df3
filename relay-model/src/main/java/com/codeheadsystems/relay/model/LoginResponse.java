package com.codeheadsystems.relay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a successful token issuance.
 * <p>
 * The token is single use: it is consumed by the first admission attempt that presents it,
 * successful or not, and expires on its own after the retention window.
 * <p>
 * Used by: {@code POST /login}, presented back as {@code GET /ws?otp=...}
 *
 * @param otp the one-time admission token
 */
public record LoginResponse(@JsonProperty("otp") String otp) {
}
