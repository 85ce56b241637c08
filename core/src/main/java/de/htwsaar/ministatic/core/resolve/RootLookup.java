package de.htwsaar.ministatic.core.resolve;

import java.io.IOException;
import java.util.Objects;

/**
 * Ergebnis der Suche über alle Roots.
 */
public sealed interface RootLookup permits RootLookup.Found, RootLookup.NotFound, RootLookup.Failed {

    /** Ein Root lieferte einen Treffer (Datei oder Verzeichnis). */
    record Found(ResolvedFile file) implements RootLookup {
        public Found {
            Objects.requireNonNull(file, "file must not be null");
        }
    }

    /** Kein Root enthält den Pfad. */
    record NotFound() implements RootLookup {}

    /** Stat-Fehler, der kein "nicht gefunden" ist; bricht die Suche ab. */
    record Failed(IOException cause) implements RootLookup {
        public Failed {
            Objects.requireNonNull(cause, "cause must not be null");
        }
    }
}
