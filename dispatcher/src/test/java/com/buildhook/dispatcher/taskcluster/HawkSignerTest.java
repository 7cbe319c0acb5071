package com.buildhook.dispatcher.taskcluster;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class HawkSignerTest {

    static final Pattern FIELD = Pattern.compile("(\\w+)=\"([^\"]*)\"");

    ObjectMapper json = new ObjectMapper();

    @Test
    void normalized_matchesHawkHeaderFormat() {
        String normalized = HawkSigner.normalized(1353832234L, "j4h3g2", "get",
                URI.create("http://example.com:8000/resource/1?b=1&a=2"), "some-app-ext-data");

        assertThat(normalized).isEqualTo(
                "hawk.1.header\n1353832234\nj4h3g2\nGET\n/resource/1?b=1&a=2\nexample.com\n8000\n\nsome-app-ext-data\n");
    }

    @Test
    void normalized_defaultsHttpsPortTo443() {
        String normalized = HawkSigner.normalized(1L, "n", "PUT",
                URI.create("https://queue.example.net/api/queue/v1/task/abc"), "");

        assertThat(normalized).contains("\nqueue.example.net\n443\n");
    }

    @Test
    void normalized_underTurkishLocale_keepsAsciiCaseMapping() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            String normalized = HawkSigner.normalized(1L, "n", "options",
                    URI.create("https://QUEUE.TASKCLUSTER.NET/api/queue/v1/ping"), "");

            assertThat(normalized).contains("\nOPTIONS\n").contains("\nqueue.taskcluster.net\n443\n");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void mac_knownVector() {
        HawkSigner signer = new HawkSigner("dh37fgj492je", "werxhqb98rpaxn39848xrunpaw3489ruxnpa98w4rxn",
                json, Clock.systemUTC());

        String mac = signer.mac(
                "hawk.1.header\n1353832234\nj4h3g2\nGET\n/resource/1?b=1&a=2\nexample.com\n8000\n\nsome-app-ext-data\n");

        assertThat(mac).isEqualTo("6R4rV5iE+NPoym+WwjeHzjAGXUtLNIxmo1vpMofpLAE=");
    }

    @Test
    void authorization_carriesAuthorizedScopesAndValidMac() throws Exception {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        HawkSigner signer = new HawkSigner("project/github", "secret-token", json,
                Clock.fixed(now, ZoneOffset.UTC));
        URI uri = URI.create("https://tc.example.net/api/queue/v1/task/abc");

        String header = signer.authorization("PUT", uri, List.of("assume:repo:github.com/org/repo:branch:main"));

        assertThat(header).startsWith("Hawk id=\"project/github\"");
        Map<String, String> fields = fields(header);
        assertThat(fields.get("ts")).isEqualTo(String.valueOf(now.getEpochSecond()));
        assertThat(fields.get("nonce")).hasSize(6);

        JsonNode ext = json.readTree(Base64.getDecoder().decode(fields.get("ext")));
        assertThat(ext.path("authorizedScopes").get(0).asText())
                .isEqualTo("assume:repo:github.com/org/repo:branch:main");

        String expected = signer.mac(HawkSigner.normalized(
                now.getEpochSecond(), fields.get("nonce"), "PUT", uri, fields.get("ext")));
        assertThat(fields.get("mac")).isEqualTo(expected);
    }

    @Test
    void authorization_withoutScopes_omitsExt() {
        HawkSigner signer = new HawkSigner("id", "key", json, Clock.systemUTC());

        String header = signer.authorization("GET", URI.create("https://tc.example.net/x"), null);

        assertThat(header).doesNotContain("ext=");
        assertThat(header).contains("mac=\"");
    }

    private static Map<String, String> fields(String header) {
        Map<String, String> fields = new LinkedHashMap<>();
        Matcher m = FIELD.matcher(header);
        while (m.find()) {
            fields.put(m.group(1), m.group(2));
        }
        return fields;
    }
}
