package com.aigreentick.services.evolutionapi.exception;

/**
 * The Evolution API server does not know the requested instance (404)
 */
public class InstanceNotFoundException extends EvolutionApiException.ClientException {

    public InstanceNotFoundException(String instanceName) {
        super("Instance not found: " + instanceName, 404);
    }
}
