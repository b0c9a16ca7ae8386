package com.elssolution.bmsdashboard.acquisition;

import com.elssolution.bmsdashboard.error.BodyDecodeException;
import com.elssolution.bmsdashboard.error.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * {@link EndpointFetcher} over {@code java.net.http}. The controller is a plain
 * HTTP device on the LAN; no credentials, no retries.
 */
@Slf4j
@Component
public class HttpEndpointFetcher implements EndpointFetcher {

    private final HttpClient httpClient;
    private final int requestTimeoutMs;

    public HttpEndpointFetcher(@Value("${bms.http.connectTimeoutMs:0}") int connectTimeoutMs,
                               @Value("${bms.http.requestTimeoutMs:0}") int requestTimeoutMs) {
        HttpClient.Builder b = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL);
        // 0 = transport default (no deadline)
        if (connectTimeoutMs > 0) b.connectTimeout(Duration.ofMillis(connectTimeoutMs));
        this.httpClient = b.build();
        this.requestTimeoutMs = Math.max(0, requestTimeoutMs);
    }

    @Override
    public String fetch(String address, String resource) throws TransportException, BodyDecodeException {
        URI uri = resolve(address, resource);
        HttpRequest.Builder rb = HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", "text/html,*/*")
                .header("User-Agent", "BmsDashboard/1.0")
                .GET();
        if (requestTimeoutMs > 0) rb.timeout(Duration.ofMillis(requestTimeoutMs));

        HttpResponse<byte[]> resp;
        try {
            resp = httpClient.send(rb.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new TransportException("GET " + uri + " failed: " + e, e);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransportException("GET " + uri + " interrupted", ie);
        }

        int sc = resp.statusCode();
        if (sc / 100 != 2) {
            throw new TransportException("GET " + uri + " returned HTTP " + sc, sc);
        }

        Charset cs = charsetOf(resp.headers().firstValue("Content-Type").orElse(""));
        String body = decode(resp.body(), cs, uri);
        if (log.isDebugEnabled()) {
            log.debug("bms_http_ok uri={} status={} chars={}", uri, sc, body.length());
        }
        return body;
    }

    // ===== Helpers =====

    static URI resolve(String address, String resource) throws TransportException {
        if (address == null || address.isBlank()) {
            throw new TransportException("controller address not configured", -1);
        }
        String base = address.trim();
        if (!base.contains("://")) base = "http://" + base;
        try {
            return URI.create(safeJoin(base, resource));
        } catch (IllegalArgumentException e) {
            throw new TransportException("bad controller address '" + address + "': " + e.getMessage(), e);
        }
    }

    private static String safeJoin(String base, String path) {
        if (base.endsWith("/") && path.startsWith("/")) return base.substring(0, base.length() - 1) + path;
        if (!base.endsWith("/") && !path.startsWith("/")) return base + "/" + path;
        return base + path;
    }

    static Charset charsetOf(String contentType) {
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = p.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    log.warn("bms_http_unknown_charset '{}', falling back to UTF-8", name);
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static String decode(byte[] body, Charset cs, URI uri) throws BodyDecodeException {
        try {
            return cs.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(body))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new BodyDecodeException("body of " + uri + " is not valid " + cs.name(), e);
        }
    }
}
