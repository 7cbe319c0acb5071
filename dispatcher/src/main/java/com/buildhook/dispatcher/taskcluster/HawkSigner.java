package com.buildhook.dispatcher.taskcluster;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds Hawk {@code Authorization} headers for Taskcluster API calls.
 *
 * Taskcluster carries authorized scopes in the Hawk {@code ext} field as
 * base64-encoded JSON, {@code {"authorizedScopes": [...]}}; the server then
 * limits the request to the intersection of the client's scopes and those.
 * Payload hashes are not used.
 */
class HawkSigner {

    private static final String NONCE_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String       clientId;
    private final String       accessToken;
    private final ObjectMapper json;
    private final Clock        clock;

    HawkSigner(String clientId, String accessToken, ObjectMapper json, Clock clock) {
        this.clientId    = clientId;
        this.accessToken = accessToken;
        this.json        = json;
        this.clock       = clock;
    }

    String authorization(String method, URI uri, List<String> authorizedScopes) {
        long   ts    = clock.instant().getEpochSecond();
        String nonce = nonce();
        String ext   = ext(authorizedScopes);
        String mac   = mac(normalized(ts, nonce, method, uri, ext));

        StringBuilder header = new StringBuilder("Hawk id=\"").append(clientId)
                .append("\", ts=\"").append(ts)
                .append("\", nonce=\"").append(nonce).append('"');
        if (!ext.isEmpty()) {
            header.append(", ext=\"").append(ext).append('"');
        }
        return header.append(", mac=\"").append(mac).append('"').toString();
    }

    /** The string the MAC is computed over (Hawk header format, version 1). */
    static String normalized(long ts, String nonce, String method, URI uri, String ext) {
        String resource = uri.getRawPath() + (uri.getRawQuery() != null ? "?" + uri.getRawQuery() : "");
        return "hawk.1.header\n"
                + ts + "\n"
                + nonce + "\n"
                + method.toUpperCase(Locale.ROOT) + "\n"
                + resource + "\n"
                + uri.getHost().toLowerCase(Locale.ROOT) + "\n"
                + port(uri) + "\n"
                + "\n"                                                   // payload hash (unused)
                + ext.replace("\\", "\\\\").replace("\n", "\\n") + "\n";
    }

    private String ext(List<String> authorizedScopes) {
        if (authorizedScopes == null) {
            return "";
        }
        try {
            byte[] ext = json.writeValueAsBytes(Map.of("authorizedScopes", authorizedScopes));
            return Base64.getEncoder().encodeToString(ext);
        } catch (JsonProcessingException e) {
            throw new JobPlatformException("Could not encode authorized scopes", e);
        }
    }

    String mac(String normalized) {
        try {
            Mac hmac = Mac.getInstance("HmacSHA256");
            hmac.init(new SecretKeySpec(accessToken.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return Base64.getEncoder().encodeToString(
                    hmac.doFinal(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private static int port(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "http".equalsIgnoreCase(uri.getScheme()) ? 80 : 443;
    }

    private static String nonce() {
        StringBuilder sb = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            sb.append(NONCE_CHARS.charAt(RANDOM.nextInt(NONCE_CHARS.length())));
        }
        return sb.toString();
    }
}
