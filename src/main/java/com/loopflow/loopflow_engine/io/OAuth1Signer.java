package com.loopflow.loopflow_engine.io;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * OAuth 1.0a HMAC-SHA1 request signing (RFC 5849), as required by the Twitter/X v2 user
 * context endpoints. JSON bodies are not part of the signature; query and form parameters are.
 */
@Component
public class OAuth1Signer {

    public record Keys(String consumerKey, String consumerSecret, String token, String tokenSecret) {
    }

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Clock clock;
    private final Supplier<String> nonceSource;

    public OAuth1Signer() {
        this(Clock.systemUTC(), OAuth1Signer::randomNonce);
    }

    OAuth1Signer(Clock clock, Supplier<String> nonceSource) {
        this.clock = clock;
        this.nonceSource = nonceSource;
    }

    /**
     * Authorization header value for one request.
     *
     * @param baseUrl    scheme, host and path; no query string
     * @param parameters decoded query (or form) parameters sent with the request
     */
    public String authorizationHeader(String method, String baseUrl, Map<String, String> parameters, Keys keys) {
        Map<String, String> oauth = new TreeMap<>();
        oauth.put("oauth_consumer_key", keys.consumerKey());
        oauth.put("oauth_nonce", nonceSource.get());
        oauth.put("oauth_signature_method", "HMAC-SHA1");
        oauth.put("oauth_timestamp", Long.toString(clock.instant().getEpochSecond()));
        oauth.put("oauth_token", keys.token());
        oauth.put("oauth_version", "1.0");

        Map<String, String> all = new TreeMap<>(oauth);
        all.putAll(parameters);
        String parameterString = all.entrySet().stream()
                .map(e -> percentEncode(e.getKey()) + "=" + percentEncode(e.getValue()))
                .collect(Collectors.joining("&"));

        String baseString = method.toUpperCase() + "&" + percentEncode(baseUrl) + "&" + percentEncode(parameterString);
        String signingKey = percentEncode(keys.consumerSecret()) + "&" + percentEncode(keys.tokenSecret());
        oauth.put("oauth_signature", hmacSha1(signingKey, baseString));

        return "OAuth " + oauth.entrySet().stream()
                .map(e -> percentEncode(e.getKey()) + "=\"" + percentEncode(e.getValue()) + "\"")
                .collect(Collectors.joining(", "));
    }

    /** RFC 3986 encoding: only ALPHA, DIGIT and "-._~" pass through. */
    public static String percentEncode(String value) {
        if (value == null) return "";
        StringBuilder sb = new StringBuilder();
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xFF);
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '.' || c == '_' || c == '~') {
                sb.append(c);
            } else {
                sb.append('%').append(String.format("%02X", b & 0xFF));
            }
        }
        return sb.toString();
    }

    static String hmacSha1(String key, String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA1");
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), "HmacSHA1"));
            return Base64.getEncoder().encodeToString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 unavailable", e);
        }
    }

    private static String randomNonce() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return Base64.getEncoder().encodeToString(bytes).replaceAll("\\W", "");
    }
}
