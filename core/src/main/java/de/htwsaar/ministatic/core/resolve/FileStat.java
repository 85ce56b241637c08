package de.htwsaar.ministatic.core.resolve;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Dateisystem-Metadaten, die für Header und Freshness benötigt werden.
 *
 * @param size               Dateigröße in Bytes
 * @param lastModifiedMillis Änderungszeitpunkt in ms seit Epoch
 * @param directory          {@code true} bei Verzeichnissen
 */
public record FileStat(long size, long lastModifiedMillis, boolean directory) {

    /**
     * Liest die Attribute einer Datei (folgt symbolischen Links).
     *
     * @param path Dateipfad
     * @return Metadaten
     * @throws IOException z. B. {@link java.nio.file.NoSuchFileException}, wenn nichts existiert
     */
    public static FileStat of(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        return new FileStat(attrs.size(), attrs.lastModifiedTime().toMillis(), attrs.isDirectory());
    }
}
