package de.htwsaar.ministatic.core.mime;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ContentTypeResolverTest {

    private static final byte[] PNG = {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A, 0x00};
    private static final byte[] GIF = "GIF89a....".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] WEBP = "RIFF\0\0\0\0WEBPVP8 ".getBytes(StandardCharsets.US_ASCII);

    private final ContentTypeResolver resolver = ContentTypeResolver.defaults();

    @Test
    void extensionDecidesWhenKnown() {
        assertEquals("text/html", resolver.resolve("/www/index.html", new byte[0]));
        assertEquals("text/css", resolver.resolve("/www/site.css", new byte[0]));
        assertEquals("image/png", resolver.resolve("/www/logo.png", new byte[0]));
    }

    @Test
    void extensionWinsOverContent() {
        assertEquals("text/plain", resolver.resolve("/www/actually-png.txt", PNG));
    }

    @Test
    void unknownExtensionFallsBackToSniffing() {
        assertEquals("image/png", resolver.resolve("/www/blob.unknownext", PNG));
        assertEquals("image/gif", resolver.resolve("/www/noext", GIF));
        assertEquals("image/webp", resolver.resolve("/www/noext", WEBP));
    }

    @Test
    void unrecognizedContentIsOctetStream() {
        assertEquals(MimeTypeResolver.OCTET_STREAM,
                resolver.resolve("/www/blob.unknownext", "hello".getBytes(StandardCharsets.UTF_8)));
        assertEquals(MimeTypeResolver.OCTET_STREAM, resolver.resolve("/www/empty", new byte[0]));
    }

    @Test
    void sniffersAreAskedInOrder() {
        ContentSniffer first = c -> Optional.of("application/x-first");
        ContentSniffer second = c -> Optional.of("application/x-second");
        ContentTypeResolver custom = new ContentTypeResolver(p -> MimeTypeResolver.OCTET_STREAM, List.of(first, second));

        assertEquals("application/x-first", custom.resolve("x", PNG));
    }

    @Test
    void snifferNeedsTheCompleteSignature() {
        ImageSignatureSniffer sniffer = new ImageSignatureSniffer();

        assertEquals(Optional.of("image/jpeg"), sniffer.sniff(new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00}));
        assertTrue(sniffer.sniff(new byte[] {(byte) 0xFF, (byte) 0xD8}).isEmpty());
        assertTrue(sniffer.sniff(null).isEmpty());
    }
}
