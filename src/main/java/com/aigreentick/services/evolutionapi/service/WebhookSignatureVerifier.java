package com.aigreentick.services.evolutionapi.service;

import com.aigreentick.services.evolutionapi.constants.EvolutionConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;

/**
 * HMAC-SHA256 verification of Evolution API webhooks.
 *
 * Security:
 *   The server signs the raw request body with the shared secret and sends the
 *   lowercase hex digest in one of three headers. Only the first header present
 *   (in {@link #SIGNATURE_HEADERS} order) is looked at; the others are ignored
 *   even when they carry a different value.
 *
 *   An empty secret, or verify-signature=false, allows every request. This is
 *   the configured opt-out and is logged as a warning at startup.
 *
 * Pure: no I/O, no state. The controller turns a rejection into a 401.
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {

    private static final String HMAC_ALGO = "HmacSHA256";

    public static final List<String> SIGNATURE_HEADERS = List.of(
            EvolutionConstants.HEADER_WEBHOOK_SIGNATURE,
            EvolutionConstants.HEADER_EVOLUTION_SIGNATURE,
            EvolutionConstants.HEADER_SIGNATURE
    );

    public SignatureVerification verify(byte[] rawBody, HttpHeaders headers, String secret, boolean enabled) {
        return verify(SignatureContext.builder()
                .rawBody(rawBody)
                .providedSignature(selectSignature(headers))
                .secret(secret)
                .verificationEnabled(enabled)
                .build());
    }

    public SignatureVerification verify(SignatureContext context) {
        if (!context.isVerificationEnabled() || isBlank(context.getSecret())) {
            return SignatureVerification.allow();
        }

        String provided = context.getProvidedSignature();
        if (provided == null || provided.isEmpty()) {
            log.warn("Webhook rejected: no signature header");
            return SignatureVerification.reject(EvolutionConstants.ERROR_MISSING_SIGNATURE);
        }

        byte[] expected = sign(context.getSecret(), context.getRawBody())
                .getBytes(StandardCharsets.US_ASCII);
        byte[] received = provided.getBytes(StandardCharsets.UTF_8);

        // MessageDigest.isEqual does not short-circuit on the first differing byte
        if (!MessageDigest.isEqual(expected, received)) {
            log.warn("Webhook rejected: HMAC mismatch");
            return SignatureVerification.reject(EvolutionConstants.ERROR_INVALID_SIGNATURE);
        }

        log.debug("Webhook signature verified OK");
        return SignatureVerification.allow();
    }

    /**
     * Lowercase hex HMAC-SHA256 of {@code body} under {@code secret}.
     */
    public String sign(String secret, byte[] body) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGO);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGO));
            return HexFormat.of().formatHex(mac.doFinal(body == null ? new byte[0] : body));
        } catch (GeneralSecurityException ex) {
            // HmacSHA256 is mandatory on every JRE
            throw new IllegalStateException("HMAC-SHA256 unavailable", ex);
        }
    }

    /**
     * First signature header present, in priority order. A header that is
     * present but empty still wins and is then treated as missing.
     */
    String selectSignature(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        for (String name : SIGNATURE_HEADERS) {
            String value = headers.getFirst(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
