// file: server/src/main/java/io/tagvault/server/store/PageIds.java
package io.tagvault.server.store;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

/**
 * Derives page identity and domain from a URL.
 * The id is a pure function of the URL, so registering a URL twice
 * addresses the same page.
 */
final class PageIds {

    private PageIds() {
    }

    static String idFor(String url) {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(url.getBytes(StandardCharsets.UTF_8));
    }

    /** Host for hierarchical URLs, "&lt;scheme&gt;-page" otherwise, "internal-page" if unparseable. */
    static String domainOf(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getHost() != null) return uri.getHost().toLowerCase(Locale.ROOT);
            if (uri.getScheme() != null) return uri.getScheme().toLowerCase(Locale.ROOT) + "-page";
        } catch (URISyntaxException e) {
            // fall through
        }
        return "internal-page";
    }
}
