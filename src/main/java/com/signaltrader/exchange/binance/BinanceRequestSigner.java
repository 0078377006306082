package com.signaltrader.exchange.binance;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.Map;
import java.util.stream.Collectors;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Builds signed query strings for Binance USD-M futures endpoints.
 * The signature is the hex HMAC-SHA256 of the exact encoded query string.
 */
public class BinanceRequestSigner {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private final String secretKey;

    public BinanceRequestSigner(String secretKey) {
        this.secretKey = secretKey;
    }

    /** Parameters are kept in insertion order; the returned string ends with {@code &signature=...}. */
    public String signedQuery(Map<String, String> params) {
        String query = toQueryString(params);
        return query + "&signature=" + sign(query);
    }

    public String sign(String payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    public static String toQueryString(Map<String, String> params) {
        return params.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
