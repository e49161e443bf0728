package de.htwsaar.miniota.cli.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.Optional;

/**
 * URI-Hilfen für CLI-Eingaben.
 */
public final class UriUtils {
    private UriUtils() {}

    public static URI ensureTrailingSlash(URI uri) {
        Objects.requireNonNull(uri, "uri");
        String s = uri.toString();
        return URI.create(s.endsWith("/") ? s : s + "/");
    }

    /**
     * @param raw Eingabe wie {@code http://192.168.4.1:5005}
     * @return URI mit http/https-Schema und Host, sonst leer
     */
    public static Optional<URI> parseHttpUri(String raw) {
        if (raw == null) return Optional.empty();
        String trimmed = raw.trim();
        try {
            URI u = new URI(trimmed);
            String scheme = u.getScheme();
            if (scheme == null || u.getHost() == null) return Optional.empty();
            if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) return Optional.empty();
            return Optional.of(u);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    /**
     * @param base Server-Basis-URL
     * @param path Endpunkt wie {@code /version}
     * @return absolute URI des Endpunkts
     */
    public static URI endpoint(URI base, String path) {
        String p = path.startsWith("/") ? path.substring(1) : path;
        return ensureTrailingSlash(base).resolve(p);
    }
}
