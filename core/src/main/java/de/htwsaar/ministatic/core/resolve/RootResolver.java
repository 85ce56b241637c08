package de.htwsaar.ministatic.core.resolve;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Löst einen dekodierten Request-Pfad über eine geordnete Liste von Roots auf.
 *
 * <p>Regeln:
 * <ul>
 *   <li>Roots werden in Reihenfolge probiert, der erste Stat-Treffer gewinnt.</li>
 *   <li>Endet der Pfad auf einen Separator, wird {@code index.html} angehängt.</li>
 *   <li>{@link NoSuchFileException} bedeutet "nächster Root", jeder andere Fehler bricht ab.</li>
 * </ul>
 */
public final class RootResolver {

    public static final String INDEX_FILE = "index.html";

    private static final Logger log = LoggerFactory.getLogger(RootResolver.class);

    private final List<Path> roots;

    public RootResolver(List<Path> roots) {
        this.roots = List.copyOf(Objects.requireNonNull(roots, "roots must not be null"));
    }

    /**
     * @param decodedPath bereits percent-dekodierter, geprüfter Pfad
     * @return Found, NotFound oder Failed
     */
    public RootLookup resolve(String decodedPath) {
        String relative = withIndex(decodedPath);
        for (Path root : roots) {
            Path candidate;
            try {
                candidate = candidate(root, relative);
            } catch (InvalidPathException e) {
                log.debug("Skipping root {}: invalid path {}", root, relative);
                continue;
            }
            try {
                FileStat stat = FileStat.of(candidate);
                log.debug("Resolved {} to {}", decodedPath, candidate);
                return new RootLookup.Found(new ResolvedFile(candidate, stat));
            } catch (NoSuchFileException e) {
                // nächster Root
            } catch (IOException e) {
                return new RootLookup.Failed(e);
            }
        }
        return new RootLookup.NotFound();
    }

    /**
     * Hängt {@code index.html} an, wenn der Pfad auf einen Separator endet.
     *
     * @param decodedPath dekodierter Pfad
     * @return Pfad, der auf eine Datei zeigt
     */
    public static String withIndex(String decodedPath) {
        String p = decodedPath.isEmpty() ? "/" : decodedPath;
        if (p.endsWith("/") || p.endsWith("\\")) {
            return p + INDEX_FILE;
        }
        return p;
    }

    private static Path candidate(Path root, String relative) {
        String r = root.toString();
        if (r.endsWith("/") || r.endsWith("\\")) r = r.substring(0, r.length() - 1);
        String sep = relative.startsWith("/") || relative.startsWith("\\") ? "" : "/";
        return Path.of(r + sep + relative);
    }
}
