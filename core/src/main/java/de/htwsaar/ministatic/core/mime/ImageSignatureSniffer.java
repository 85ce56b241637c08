package de.htwsaar.ministatic.core.mime;

import java.util.List;
import java.util.Optional;

/**
 * Erkennt gängige Bildformate an ihrer Magic-Number.
 */
public final class ImageSignatureSniffer implements ContentSniffer {

    /** -1 = beliebiges Byte */
    private record Signature(String mimeType, int offset, int[] magic) {

        boolean matches(byte[] content) {
            if (content.length < offset + magic.length) return false;
            for (int i = 0; i < magic.length; i++) {
                if (magic[i] != -1 && (content[offset + i] & 0xFF) != magic[i]) return false;
            }
            return true;
        }
    }

    private static final List<Signature> SIGNATURES = List.of(
            new Signature("image/png", 0, new int[] {0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A}),
            new Signature("image/jpeg", 0, new int[] {0xFF, 0xD8, 0xFF}),
            new Signature("image/gif", 0, new int[] {0x47, 0x49, 0x46, 0x38, -1, 0x61}),
            new Signature("image/webp", 0, new int[] {0x52, 0x49, 0x46, 0x46, -1, -1, -1, -1, 0x57, 0x45, 0x42, 0x50}),
            new Signature("image/bmp", 0, new int[] {0x42, 0x4D}),
            new Signature("image/x-icon", 0, new int[] {0x00, 0x00, 0x01, 0x00}),
            new Signature("image/tiff", 0, new int[] {0x49, 0x49, 0x2A, 0x00}),
            new Signature("image/tiff", 0, new int[] {0x4D, 0x4D, 0x00, 0x2A}));

    @Override
    public Optional<String> sniff(byte[] content) {
        if (content == null || content.length == 0) return Optional.empty();
        for (Signature s : SIGNATURES) {
            if (s.matches(content)) return Optional.of(s.mimeType());
        }
        return Optional.empty();
    }
}
