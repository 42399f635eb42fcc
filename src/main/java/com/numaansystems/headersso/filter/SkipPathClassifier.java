package com.numaansystems.headersso.filter;

import com.numaansystems.headersso.config.HeaderAuthProperties;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a request path is exempt from header authentication.
 *
 * <p>Exempt are health and metrics endpoints, webhooks, the host's own
 * login, logout, MFA, password reset and signup endpoints, static asset
 * directories, and any path ending in a static file extension. The check is
 * pure and cheap, and runs before any header is read.</p>
 *
 * <h2>Matching</h2>
 * <ul>
 *   <li>Prefix rules match with {@code startsWith}, so {@code /webhook}
 *       also covers {@code /webhook/abc} and {@code /webhook-test}</li>
 *   <li>Extension rules match the last path segment's suffix, ignoring case</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class SkipPathClassifier {

    private final List<String> prefixes;
    private final List<String> suffixes;

    public SkipPathClassifier(List<String> prefixes, List<String> extensions) {
        this.prefixes = List.copyOf(prefixes);
        this.suffixes = extensions.stream()
                .map(ext -> "." + ext.toLowerCase(Locale.ROOT))
                .toList();
    }

    public static SkipPathClassifier from(HeaderAuthProperties.Skip skip) {
        return new SkipPathClassifier(skip.paths(), skip.extensions());
    }

    /**
     * Returns true if the path must not be authenticated from headers.
     *
     * @param path request path relative to the context, without query string
     * @return true to skip; false for null or empty paths
     */
    public boolean shouldSkip(String path) {
        if (path == null || path.isEmpty()) {
            return false;
        }

        for (String prefix : prefixes) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }

        String lower = path.toLowerCase(Locale.ROOT);
        for (String suffix : suffixes) {
            if (lower.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }
}
