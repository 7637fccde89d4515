package com.company.scheduler.client;

/**
 * Chat-style text generation.
 */
public interface TextGenerationClient {

    /**
     * @return the reply text; never null
     * @throws com.company.scheduler.exception.UpstreamUnavailableException when the service cannot be reached
     */
    String complete(String model, String systemPrompt, String userPrompt);
}
