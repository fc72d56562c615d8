package com.frogolio.frogol.service;

/**
 * Makes link targets absolute. Hosts are not validated.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    public static String normalize(String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        return "https://" + trimmed;
    }
}
