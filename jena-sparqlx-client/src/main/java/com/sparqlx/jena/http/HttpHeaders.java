package com.sparqlx.jena.http;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.apache.jena.atlas.web.ContentType;

/**
 * Case-insensitive, read-only view over response headers.
 */
public final class HttpHeaders {
    /** Header values keyed case-insensitively. */
    private final Map<String, List<String>> headers;

    /**
     * Create a header view.
     *
     * @param source header values by name; copied
     */
    public HttpHeaders(final Map<String, List<String>> source) {
        Map<String, List<String>> copy =
            new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, List<String>> entry : source.entrySet()) {
            if (entry.getKey() != null) {
                copy.put(entry.getKey(), List.copyOf(entry.getValue()));
            }
        }
        this.headers = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the first value of a header.
     *
     * @param name the header name, any case
     * @return the first value, or null if absent
     */
    public String first(final String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * Returns all values of a header.
     *
     * @param name the header name, any case
     * @return the values, empty if absent
     */
    public List<String> all(final String name) {
        return headers.getOrDefault(name, List.of());
    }

    /**
     * Returns every header.
     *
     * @return header values by name
     */
    public Map<String, List<String>> asMap() {
        return headers;
    }

    /**
     * Returns the charset named by a Content-Type value.
     *
     * @param contentType the header value, possibly null
     * @param fallback the charset used when none is named or the named one
     *     is not supported
     * @return the charset
     */
    public static Charset charset(final String contentType,
                                  final Charset fallback) {
        if (contentType == null || contentType.isBlank()) {
            return fallback;
        }
        String name = ContentType.create(contentType).getCharset();
        if (name == null) {
            return fallback;
        }
        try {
            return Charset.isSupported(name) ? Charset.forName(name) : fallback;
        } catch (IllegalCharsetNameException e) {
            return fallback;
        }
    }

    /**
     * Returns the bare MIME type of a Content-Type value: everything before
     * the first {@code ;}, trimmed and lower-cased.
     *
     * @param contentType the header value, possibly null
     * @return the MIME type, or null if the value is null or blank
     */
    public static String mimeType(final String contentType) {
        if (contentType == null) {
            return null;
        }
        int semicolon = contentType.indexOf(';');
        String mime = (semicolon < 0
            ? contentType : contentType.substring(0, semicolon)).strip();
        return mime.isEmpty() ? null : mime.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return headers.toString();
    }
}
