package de.htwsaar.ministatic.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Transformation des geladenen Datei-Inhalts vor Caching und Auslieferung
 * (z. B. Minifizierung on-the-fly). Das Ergebnis ersetzt den Body vollständig.
 */
@FunctionalInterface
public interface BodyTransform {

    /**
     * @param file aufgelöster Dateipfad
     * @param raw  rohe Datei-Bytes
     * @return neuer Body (darf nicht {@code null} sein)
     * @throws IOException wenn die Transformation fehlschlägt
     */
    byte[] apply(Path file, byte[] raw) throws IOException;
}
