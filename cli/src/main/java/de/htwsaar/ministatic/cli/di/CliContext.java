package de.htwsaar.ministatic.cli.di;

import java.io.PrintWriter;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * Gemeinsamer Laufzeit-Kontext für CLI-Commands.
 *
 * <p>Enthält nur generische Abhängigkeiten (Ausgabekanäle, HTTP-Client, Timeout),
 * keine fachlichen Services.</p>
 */
public final class CliContext {
    private final PrintWriter out;
    private final PrintWriter err;
    private final HttpClient httpClient;
    private final Duration defaultRequestTimeout;

    /**
     * @param out Writer für normale Ausgaben
     * @param err Writer für Fehlermeldungen
     * @param httpClient gemeinsamer HTTP-Client
     * @param defaultRequestTimeout Standard-Timeout für HTTP-Requests
     */
    public CliContext(PrintWriter out, PrintWriter err, HttpClient httpClient, Duration defaultRequestTimeout) {
        this.out = Objects.requireNonNull(out);
        this.err = Objects.requireNonNull(err);
        this.httpClient = Objects.requireNonNull(httpClient);
        this.defaultRequestTimeout = Objects.requireNonNull(defaultRequestTimeout);
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    public Duration defaultRequestTimeout() {
        return defaultRequestTimeout;
    }
}
