package de.htwsaar.ministatic.core.mime;

/**
 * Reine Funktion: MIME-Type anhand des Dateipfads (Endung).
 */
@FunctionalInterface
public interface MimeTypeResolver {

    String OCTET_STREAM = "application/octet-stream";

    /**
     * @param path Dateipfad oder -name
     * @return MIME-Type, nie {@code null}; unbekannt = {@link #OCTET_STREAM}
     */
    String mimeTypeForPath(String path);
}
