package com.e2eq.conformance.transducer;

/**
 * Chat-completion endpoint flavours. They differ in URL layout and authentication header.
 */
public enum EndpointKind {
    /** {@code {base}/chat/completions} with {@code Authorization: Bearer <key>}. */
    OPENAI_COMPATIBLE,
    /** {@code {base}/openai/deployments/{model}/chat/completions?api-version=...} with {@code api-key}. */
    AZURE
}
