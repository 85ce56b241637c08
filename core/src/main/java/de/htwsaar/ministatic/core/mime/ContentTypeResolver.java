package de.htwsaar.ministatic.core.mime;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bestimmt den Content-Type: zuerst über die Endung, bei generischem Fallback
 * ({@code application/octet-stream}) über die registrierten {@link ContentSniffer}.
 */
public final class ContentTypeResolver {

    private final MimeTypeResolver mimeTypes;
    private final List<ContentSniffer> sniffers;

    public ContentTypeResolver(MimeTypeResolver mimeTypes, List<ContentSniffer> sniffers) {
        this.mimeTypes = Objects.requireNonNull(mimeTypes, "mimeTypes must not be null");
        this.sniffers = List.copyOf(Objects.requireNonNull(sniffers, "sniffers must not be null"));
    }

    /** Endungs-Lookup über Spring plus Bild-Signaturen. */
    public static ContentTypeResolver defaults() {
        return new ContentTypeResolver(new SpringMediaTypeResolver(), List.of(new ImageSignatureSniffer()));
    }

    /**
     * @param path    Dateipfad (für die Endung)
     * @param content ausgelieferter Inhalt
     * @return aufgelöster MIME-Type
     */
    public String resolve(String path, byte[] content) {
        String byExtension = mimeTypes.mimeTypeForPath(path);
        if (byExtension != null && !MimeTypeResolver.OCTET_STREAM.equals(byExtension)) {
            return byExtension;
        }
        for (ContentSniffer sniffer : sniffers) {
            Optional<String> sniffed = sniffer.sniff(content);
            if (sniffed.isPresent()) return sniffed.get();
        }
        return MimeTypeResolver.OCTET_STREAM;
    }
}
