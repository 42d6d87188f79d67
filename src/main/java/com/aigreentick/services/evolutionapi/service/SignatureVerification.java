package com.aigreentick.services.evolutionapi.service;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Outcome of a webhook signature check: allow, or reject with a reason
 * that is returned to the sender.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class SignatureVerification {

    private static final SignatureVerification ALLOW = new SignatureVerification(true, null);

    private final boolean allowed;
    private final String reason;

    public static SignatureVerification allow() {
        return ALLOW;
    }

    public static SignatureVerification reject(String reason) {
        return new SignatureVerification(false, reason);
    }
}
