package de.htwsaar.ministatic.common.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Objects;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/**
 * Protects the cache administration endpoints with a shared admin token.
 */
public class AdminAuthFilter extends OncePerRequestFilter {

    /** Header expected to carry the admin token. */
    public static final String AUTH_HEADER = "X-Admin-Token";

    /** Path prefix of all routes that require the token. */
    public static final String ADMIN_PATH_PREFIX = "/api/static/cache";

    private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

    private final String expectedToken;

    /**
     * @param expectedToken the token incoming admin requests must present
     */
    public AdminAuthFilter(String expectedToken) {
        this.expectedToken = Objects.requireNonNull(expectedToken, "expectedToken must not be null");
    }

    /**
     * Rejects admin requests without a token (401) or with a wrong one (403).
     * Static file requests pass through untouched.
     */
    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (isAdminPath(request)) {
            String providedToken = request.getHeader(AUTH_HEADER);

            if (providedToken == null || providedToken.isBlank()) {
                response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Missing Admin Token");
                return;
            }

            if (!expectedToken.equals(providedToken)) {
                response.sendError(HttpServletResponse.SC_FORBIDDEN, "Invalid Admin Token");
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    /**
     * Matches on the decoded, normalized path within the application, the same form Spring MVC
     * routes on, so percent-encoded or dot-segment variants of the admin path are caught too.
     */
    private static boolean isAdminPath(HttpServletRequest request) {
        String path = StringUtils.cleanPath(PATH_HELPER.getPathWithinApplication(request));
        return path.equals(ADMIN_PATH_PREFIX) || path.startsWith(ADMIN_PATH_PREFIX + "/");
    }
}
