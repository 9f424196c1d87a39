package com.protocolguide.api.billing;

import com.protocolguide.saas.domain.model.BillingEvent;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * Verifies the Stripe-Signature header and decodes the event.
 *
 * Header: t=&lt;unix seconds&gt;,v1=&lt;hex&gt;[,v1=...][,v0=...]
 * Signed payload: "&lt;t&gt;." followed by the raw body bytes, HMAC-SHA256 with the endpoint secret.
 *
 * Fail-closed: any doubt is a {@link SignatureException}. Never touches storage.
 */
public class WebhookAuthenticator {

    static final String SCHEME = "v1";

    private final BillingEventDecoder decoder;
    private final Clock clock;
    private final long toleranceSeconds;

    public WebhookAuthenticator(BillingEventDecoder decoder, Clock clock, Duration tolerance) {
        this.decoder = decoder;
        this.clock = clock;
        this.toleranceSeconds = tolerance.getSeconds();
    }

    public BillingEvent verify(byte[] payload, List<String> signatureHeaders, String secret) throws SignatureException {
        if (secret == null || secret.isBlank()) {
            throw new SignatureException("Webhook secret is not configured");
        }
        if (signatureHeaders == null || signatureHeaders.isEmpty()
                || signatureHeaders.get(0) == null || signatureHeaders.get(0).isBlank()) {
            throw new SignatureException("Missing signature");
        }
        if (signatureHeaders.size() > 1) {
            throw new SignatureException("Multiple signature headers");
        }

        ParsedHeader header = parse(signatureHeaders.get(0));

        long now = clock.instant().getEpochSecond();
        long t = header.timestamp();
        if (t < now - toleranceSeconds || t > now + toleranceSeconds) {
            throw new SignatureException("Timestamp outside the tolerance zone");
        }

        byte[] expected = HexFormat.of().formatHex(hmacSha256(secret, header.timestamp(), payload))
                .getBytes(StandardCharsets.US_ASCII);
        boolean matched = false;
        for (String candidate : header.signatures()) {
            // no early exit: every candidate is compared
            matched |= MessageDigest.isEqual(expected, candidate.getBytes(StandardCharsets.US_ASCII));
        }
        if (!matched) {
            throw new SignatureException("No signatures found matching the expected signature for payload");
        }

        try {
            return decoder.decode(payload);
        } catch (IOException | IllegalArgumentException e) {
            throw new SignatureException("Invalid event payload", e);
        }
    }

    /**
     * Builds a header value the way the provider does. Used by tests and local tooling.
     */
    public static String sign(String secret, long timestamp, byte[] payload) {
        return "t=" + timestamp + "," + SCHEME + "=" + HexFormat.of().formatHex(hmacSha256(secret, timestamp, payload));
    }

    private static ParsedHeader parse(String header) throws SignatureException {
        Long timestamp = null;
        List<String> signatures = new ArrayList<>();
        for (String part : header.split(",")) {
            int eq = part.indexOf('=');
            if (eq <= 0) continue;
            String key = part.substring(0, eq).trim();
            String value = part.substring(eq + 1).trim();
            if (key.equals("t")) {
                try {
                    timestamp = Long.parseLong(value);
                } catch (NumberFormatException e) {
                    throw new SignatureException("Unable to extract timestamp and signatures from header", e);
                }
            } else if (key.equals(SCHEME) && !value.isEmpty()) {
                signatures.add(value.toLowerCase(Locale.ROOT));
            }
        }
        if (timestamp == null) {
            throw new SignatureException("Unable to extract timestamp and signatures from header");
        }
        if (signatures.isEmpty()) {
            throw new SignatureException("No signatures found with expected scheme");
        }
        return new ParsedHeader(timestamp, signatures);
    }

    private static byte[] hmacSha256(String secret, long timestamp, byte[] payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            mac.update((timestamp + ".").getBytes(StandardCharsets.UTF_8));
            return mac.doFinal(payload == null ? new byte[0] : payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute HMAC SHA-256", e);
        }
    }

    private record ParsedHeader(long timestamp, List<String> signatures) {}
}
