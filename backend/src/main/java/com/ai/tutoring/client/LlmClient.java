package com.ai.tutoring.client;

import java.io.IOException;

/**
 * Text generation capability used by the lesson report pipeline.
 * Implementations are single-shot: no retries, no caching.
 */
public interface LlmClient {

    /**
     * Sends a prompt to the configured provider.
     *
     * @param prompt the full prompt text
     * @return raw text produced by the model
     * @throws IOException if the provider cannot be reached or answers with an error
     */
    String sendPrompt(String prompt) throws IOException, InterruptedException;

    /** Name of the provider currently answering prompts. */
    String getActiveProvider();
}
