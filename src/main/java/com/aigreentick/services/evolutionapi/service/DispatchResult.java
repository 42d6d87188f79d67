package com.aigreentick.services.evolutionapi.service;

import com.aigreentick.services.evolutionapi.constants.EvolutionConstants;

/**
 * How an accepted webhook was handled
 */
public enum DispatchResult {
    QUEUED(EvolutionConstants.MSG_WEBHOOK_QUEUED),
    PROCESSED(EvolutionConstants.MSG_WEBHOOK_PROCESSED);

    private final String message;

    DispatchResult(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
