package pl.polishapi.sdk.internal;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;

/**
 * Helper methods for assembling {@link HttpRequest} instances. The SDK builds requests; sending them is left to the
 * caller's transport.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    public static HttpRequest buildRequest(URI uri, String method, Map<String, String> headers, byte[] body, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(timeout);

        if (body == null || body.length == 0) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
        }

        headers.forEach(builder::header);
        return builder.build();
    }

    /**
     * @return the raw path plus raw query of {@code uri}, as it appears in the HTTP request line.
     */
    public static String requestTarget(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        String query = uri.getRawQuery();
        return query == null ? path : path + "?" + query;
    }
}
