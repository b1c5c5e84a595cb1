package com.canary.intel.predict;

public enum FallbackSource {
    EXTERNAL,   // Supplied with the request
    PROVIDER,   // FallbackScoreProvider
    NEUTRAL     // Configured neutral score
}
