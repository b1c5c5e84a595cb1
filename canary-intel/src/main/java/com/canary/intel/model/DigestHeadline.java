package com.canary.intel.model;

/**
 * A headline as it was delivered in a digest. The content type is stored normalized.
 */
public record DigestHeadline(
    String headline,
    String source,
    String contentType,
    String url
) {}
