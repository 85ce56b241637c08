package de.htwsaar.ministatic.server.web;

import de.htwsaar.ministatic.core.RequestOptions;
import de.htwsaar.ministatic.core.StaticFileHandler;
import de.htwsaar.ministatic.core.StaticFileResponse;
import de.htwsaar.ministatic.core.StaticRequest;
import de.htwsaar.ministatic.server.StaticMetricsService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP-Adapter für statische Dateien.
 *
 * <p>Kein Fachcode hier, nur Mapping zwischen Servlet-Request und {@link StaticFileHandler}.
 * Alle Methoden landen hier; der Handler lehnt alles außer GET/HEAD ab (→ 404).</p>
 */
@RestController
public class StaticFileController {

    static final String X_CACHE = "X-Cache";

    private static final Logger log = LoggerFactory.getLogger(StaticFileController.class);

    private final StaticFileHandler handler;
    private final RequestOptions options;
    private final StaticMetricsService metricsService;

    public StaticFileController(StaticFileHandler handler, RequestOptions options, StaticMetricsService metricsService) {
        this.handler = handler;
        this.options = options;
        this.metricsService = metricsService;
    }

    /**
     * Beantwortet jeden Request, der keinem spezifischeren Mapping zugeordnet ist.
     *
     * <p>Die Antwort wird direkt auf den Servlet-Response geschrieben, damit Spring keine
     * eigene Conditional-GET-Auswertung über die Handler-Entscheidung legt.</p>
     *
     * @param request  eingehender Request
     * @param response Ziel für Status, Header und Body
     * @throws IOException wenn das Schreiben der Antwort fehlschlägt
     */
    @RequestMapping("/**")
    public void serve(HttpServletRequest request, HttpServletResponse response) throws IOException {
        StaticRequest staticRequest = toStaticRequest(request);
        Optional<StaticFileResponse> result;
        try {
            result = handler.handle(staticRequest, options);
        } catch (IOException ex) {
            log.error("Failed to serve {}", staticRequest.path(), ex);
            writePlainText(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Internal Server Error");
            return;
        }

        if (result.isEmpty()) {
            writePlainText(response, HttpServletResponse.SC_NOT_FOUND, "Not Found");
            return;
        }
        StaticFileResponse fileResponse = result.get();
        if (fileResponse.status() == HttpServletResponse.SC_OK) {
            metricsService.record(fileResponse.cacheDecision());
        }

        response.setStatus(fileResponse.status());
        fileResponse.headers().forEach(response::setHeader);
        response.setHeader(X_CACHE, fileResponse.cacheDecision().name());
        if (fileResponse.hasBody()) {
            response.getOutputStream().write(fileResponse.body());
        }
    }

    private static StaticRequest toStaticRequest(HttpServletRequest request) {
        String url = request.getRequestURI().substring(request.getContextPath().length());
        if (request.getQueryString() != null) {
            url = url + "?" + request.getQueryString();
        }
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, request.getHeader(name));
        }
        return new StaticRequest(request.getMethod(), url, headers);
    }

    private static void writePlainText(HttpServletResponse response, int status, String text) throws IOException {
        byte[] body = text.getBytes(StandardCharsets.UTF_8);
        response.setStatus(status);
        response.setContentType("text/plain; charset=utf-8");
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
    }
}
