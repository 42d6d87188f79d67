package com.aigreentick.services.evolutionapi.service;

import lombok.Builder;
import lombok.Value;

/**
 * Inputs of one signature check, built per inbound request
 */
@Value
@Builder
public class SignatureContext {

    /** Exact bytes the signature was computed over */
    byte[] rawBody;

    /** Value of the highest-priority signature header present, or null */
    String providedSignature;

    String secret;

    boolean verificationEnabled;
}
