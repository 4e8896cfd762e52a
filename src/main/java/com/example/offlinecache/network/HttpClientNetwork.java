package com.example.offlinecache.network;

import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.core.NetworkException;
import com.example.offlinecache.core.NetworkTimeoutException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Network} backed by the JDK {@link HttpClient}. Relative urls resolve against the configured origin.
 */
public class HttpClientNetwork implements Network {

    private static final Logger log = LoggerFactory.getLogger(HttpClientNetwork.class);

    // the JDK client refuses to let callers set these
    private static final Set<String> RESTRICTED_HEADERS =
        Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final HttpClient client;
    private final OriginResolver origin;
    private final Duration requestTimeout;

    public HttpClientNetwork(HttpClient client, OriginResolver origin, Duration requestTimeout) {
        this.client = client;
        this.origin = origin;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public NetResponse fetch(NetRequest request) throws NetworkException {
        URI target = resolve(request.getUrl());
        HttpRequest.BodyPublisher body = request.getBody() == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(request.getBody());
        HttpRequest.Builder builder = HttpRequest.newBuilder(target)
            .timeout(requestTimeout)
            .method(request.getMethod(), body);
        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            if (!RESTRICTED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                builder.header(header.getKey(), header.getValue());
            }
        }

        try {
            HttpResponse<String> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            for (Map.Entry<String, List<String>> header : response.headers().map().entrySet()) {
                if (!header.getValue().isEmpty() && !header.getKey().startsWith(":")) {
                    headers.put(header.getKey(), String.join(", ", header.getValue()));
                }
            }
            log.trace("{} -> {}", request, response.statusCode());
            return new NetResponse(response.statusCode(), reasonPhrase(response.statusCode()), headers, response.body());
        } catch (HttpTimeoutException e) {
            throw new NetworkTimeoutException("Request timed out: " + request);
        } catch (IOException e) {
            throw new NetworkException("Network request failed: " + request, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Interrupted while fetching " + request, e);
        }
    }

    private URI resolve(String url) throws NetworkException {
        try {
            return URI.create(origin.absolute(url));
        } catch (IllegalArgumentException e) {
            throw new NetworkException("Malformed url: " + url, e);
        }
    }

    private static String reasonPhrase(int status) {
        switch (status / 100) {
            case 2:
                return status == 200 ? "OK" : "Success";
            case 3:
                return "Redirect";
            case 4:
                return status == 404 ? "Not Found" : "Client Error";
            case 5:
                return status == 503 ? "Service Unavailable" : "Server Error";
            default:
                return "";
        }
    }
}
