package com.frogolio.frogol.image;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Identifies a file's MIME type from its leading magic bytes
 */
public final class ImageTypeDetector {

    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};
    private static final byte[] GIF87 = "GIF87a".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] GIF89 = "GIF89a".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] RIFF = "RIFF".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] WEBP = "WEBP".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] BMP = "BM".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] PDF = "%PDF".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] ZIP = {'P', 'K', 0x03, 0x04};

    private ImageTypeDetector() {
    }

    public static Optional<String> detect(byte[] data) {
        if (data == null || data.length == 0) {
            return Optional.empty();
        }
        if (startsWith(data, 0, JPEG))
            return Optional.of("image/jpeg");
        if (startsWith(data, 0, PNG))
            return Optional.of("image/png");
        if (startsWith(data, 0, GIF87) || startsWith(data, 0, GIF89))
            return Optional.of("image/gif");
        if (startsWith(data, 0, RIFF) && startsWith(data, 8, WEBP))
            return Optional.of("image/webp");
        if (startsWith(data, 0, PDF))
            return Optional.of("application/pdf");
        if (startsWith(data, 0, ZIP))
            return Optional.of("application/zip");
        // two bytes only, keep it last
        if (startsWith(data, 0, BMP))
            return Optional.of("image/bmp");
        return Optional.empty();
    }

    private static boolean startsWith(byte[] data, int offset, byte[] magic) {
        if (data.length < offset + magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (data[offset + i] != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
