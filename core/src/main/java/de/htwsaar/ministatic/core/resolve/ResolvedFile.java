package de.htwsaar.ministatic.core.resolve;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Ergebnis der Root-Auflösung für genau einen Request; wird nach dem Antwortaufbau verworfen.
 *
 * @param absolutePath gewählter Dateipfad
 * @param stat         Metadaten der Datei
 */
public record ResolvedFile(Path absolutePath, FileStat stat) {

    public ResolvedFile {
        Objects.requireNonNull(absolutePath, "absolutePath must not be null");
        Objects.requireNonNull(stat, "stat must not be null");
    }

    /** @return Dateiname ohne Verzeichnisanteil */
    public String fileName() {
        Path name = absolutePath.getFileName();
        return name == null ? "" : name.toString();
    }
}
