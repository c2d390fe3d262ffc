package com.example.filegate.security.filter;

import com.example.filegate.common.util.StringSanitizer;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Matches request paths against the protected prefix and turns the remainder into a
 * storage identifier.
 *
 * <p>With prefix {@code fileadmin/}, {@code /fileadmin/user_upload/a.pdf} yields the identifier
 * {@code /user_upload/a.pdf}. {@code /fileadmin} and {@code /fileadminX/a.pdf} do not match.</p>
 */
public class ProtectedPathMatcher {

    private final String prefixSegment;
    private final String pathPrefix;

    public ProtectedPathMatcher(String protectedPrefix) {
        String segment = stripSlashes(protectedPrefix == null ? "" : protectedPrefix.trim());
        if (segment.isEmpty()) {
            throw new IllegalArgumentException("Protected prefix must name at least one path segment");
        }
        this.prefixSegment = segment;
        this.pathPrefix = "/" + segment + "/";
    }

    public String getPrefixSegment() {
        return prefixSegment;
    }

    /**
     * Returns the raw (still percent-encoded) identifier, starting with a slash, or empty when
     * the path is outside the protected prefix.
     */
    public Optional<String> extractIdentifier(String requestPath) {
        if (requestPath == null || !requestPath.startsWith(pathPrefix)) {
            return Optional.empty();
        }
        return Optional.of(requestPath.substring(pathPrefix.length() - 1));
    }

    /**
     * Decodes a raw identifier. Empty for malformed encodings, dot segments, backslashes and
     * control characters.
     */
    public Optional<String> decodeIdentifier(String rawIdentifier) {
        String decoded;
        try {
            decoded = UriUtils.decode(rawIdentifier, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        if (decoded.indexOf('\\') >= 0 || StringSanitizer.containsControlCharacters(decoded)) {
            return Optional.empty();
        }
        for (String segment : decoded.split("/", -1)) {
            if (segment.equals(".") || segment.equals("..")) {
                return Optional.empty();
            }
        }
        return Optional.of(decoded);
    }

    private static String stripSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
