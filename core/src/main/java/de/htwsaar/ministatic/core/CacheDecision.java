package de.htwsaar.ministatic.core;

/**
 * Herkunft einer Antwort aus Sicht des Response-Caches.
 */
public enum CacheDecision {
    /** aus dem In-Memory-Cache beantwortet, kein Dateisystemzugriff */
    HIT,
    /** frisch vom Dateisystem gelesen und (bei aktivem Cache) abgelegt */
    MISS,
    /** Cache nicht beteiligt: deaktiviert, Conditional GET oder abgewiesener Request */
    BYPASS
}
