package com.aigreentick.services.evolutionapi.service;

import com.aigreentick.services.evolutionapi.constants.EvolutionConstants;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSignatureVerifierTest {

    private static final String SECRET = "s3cret";
    private static final byte[] BODY =
            "{\"event\":\"messages.upsert\",\"instance\":\"sales\"}".getBytes(StandardCharsets.UTF_8);

    private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier();

    @Test
    void testSign_KnownVector_MatchesReferenceDigest() {
        String digest = verifier.sign("key", "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.UTF_8));
        assertEquals("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8", digest);
    }

    @Test
    void testVerify_WhenSignatureMatches_Allows() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(EvolutionConstants.HEADER_WEBHOOK_SIGNATURE, verifier.sign(SECRET, BODY));

        SignatureVerification result = verifier.verify(BODY, headers, SECRET, true);

        assertTrue(result.isAllowed());
        assertNull(result.getReason());
    }

    @Test
    void testVerify_WhenNoSignatureHeader_RejectsAsMissing() {
        SignatureVerification result = verifier.verify(BODY, new HttpHeaders(), SECRET, true);

        assertFalse(result.isAllowed());
        assertEquals("Missing signature header", result.getReason());
    }

    @Test
    void testVerify_WhenSignatureWrong_RejectsAsInvalid() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(EvolutionConstants.HEADER_SIGNATURE, verifier.sign("other-secret", BODY));

        SignatureVerification result = verifier.verify(BODY, headers, SECRET, true);

        assertFalse(result.isAllowed());
        assertEquals("Invalid signature", result.getReason());
    }

    @Test
    void testVerify_WhenBodyChangedByOneBit_Rejects() {
        String signature = verifier.sign(SECRET, BODY);
        byte[] tampered = BODY.clone();
        tampered[tampered.length - 3] ^= 0x01;
        HttpHeaders headers = new HttpHeaders();
        headers.add(EvolutionConstants.HEADER_WEBHOOK_SIGNATURE, signature);

        assertFalse(verifier.verify(tampered, headers, SECRET, true).isAllowed());
    }

    @Test
    void testVerify_WhenSignatureUppercase_Rejects() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(EvolutionConstants.HEADER_WEBHOOK_SIGNATURE, verifier.sign(SECRET, BODY).toUpperCase());

        assertFalse(verifier.verify(BODY, headers, SECRET, true).isAllowed());
    }

    @Test
    void testVerify_WhenDisabled_AllowsWithoutHeader() {
        assertTrue(verifier.verify(BODY, new HttpHeaders(), SECRET, false).isAllowed());
    }

    @Test
    void testVerify_WhenSecretEmpty_AllowsAnything() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(EvolutionConstants.HEADER_WEBHOOK_SIGNATURE, "garbage");

        assertTrue(verifier.verify(BODY, headers, "", true).isAllowed());
        assertTrue(verifier.verify(BODY, new HttpHeaders(), null, true).isAllowed());
    }

    @Test
    void testVerify_WhenHigherPriorityHeaderWrong_IgnoresValidLowerHeader() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(EvolutionConstants.HEADER_WEBHOOK_SIGNATURE, "deadbeef");
        headers.add(EvolutionConstants.HEADER_EVOLUTION_SIGNATURE, verifier.sign(SECRET, BODY));

        SignatureVerification result = verifier.verify(BODY, headers, SECRET, true);

        assertFalse(result.isAllowed());
        assertEquals("Invalid signature", result.getReason());
    }

    @Test
    void testVerify_WhenOnlyLowestPriorityHeader_UsesIt() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(EvolutionConstants.HEADER_SIGNATURE, verifier.sign(SECRET, BODY));

        assertTrue(verifier.verify(BODY, headers, SECRET, true).isAllowed());
    }

    @Test
    void testSelectSignature_WhenHeaderPresentButEmpty_RejectsAsMissing() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(EvolutionConstants.HEADER_WEBHOOK_SIGNATURE, "");
        headers.add(EvolutionConstants.HEADER_SIGNATURE, verifier.sign(SECRET, BODY));

        assertEquals("", verifier.selectSignature(headers));
        assertEquals("Missing signature header", verifier.verify(BODY, headers, SECRET, true).getReason());
    }

    @Test
    void testVerify_WhenHigherPriorityHeaderValid_IgnoresInvalidLowerHeader() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(EvolutionConstants.HEADER_WEBHOOK_SIGNATURE, verifier.sign(SECRET, BODY));
        headers.add(EvolutionConstants.HEADER_EVOLUTION_SIGNATURE, "deadbeef");
        headers.add(EvolutionConstants.HEADER_SIGNATURE, "not-a-signature");

        assertTrue(verifier.verify(BODY, headers, SECRET, true).isAllowed());
    }
}
