package de.htwsaar.ministatic.core.mime;

import java.util.Optional;

/**
 * Inhaltsbasierte Erkennung des MIME-Types über die ersten Bytes.
 * Wird nur befragt, wenn die Endung keinen spezifischen Typ liefert.
 */
@FunctionalInterface
public interface ContentSniffer {

    /**
     * @param content Datei-Inhalt (es genügt ein Präfix)
     * @return präziserer MIME-Type oder leer
     */
    Optional<String> sniff(byte[] content);
}
