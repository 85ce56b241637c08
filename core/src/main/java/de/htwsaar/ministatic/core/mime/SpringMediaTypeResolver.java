package de.htwsaar.ministatic.core.mime;

import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

/**
 * {@link MimeTypeResolver} auf Basis der {@code mime.types}-Tabelle von Spring Web.
 */
public final class SpringMediaTypeResolver implements MimeTypeResolver {

    @Override
    public String mimeTypeForPath(String path) {
        if (path == null || path.isBlank()) return OCTET_STREAM;
        return MediaTypeFactory.getMediaType(path)
                .map(MediaType::toString)
                .orElse(OCTET_STREAM);
    }
}
