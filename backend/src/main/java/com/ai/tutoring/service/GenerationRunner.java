package com.ai.tutoring.service;

import com.ai.tutoring.client.LlmClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs prompts on the generation pool and waits for them with a deadline.
 *
 * <p>Every failure, including the deadline passing, is reported as an
 * {@link IOException}. On timeout the worker thread running the provider call
 * is interrupted and a late result, if any, is discarded.</p>
 */
@Slf4j
@Component
public class GenerationRunner {

    private final LlmClient llmClient;
    private final Executor executor;
    private final Duration timeout;

    public GenerationRunner(LlmClient llmClient,
                            @Qualifier("generationExecutor") Executor executor,
                            @Value("${tutoring.generation.timeout:PT90S}") Duration timeout) {
        this.llmClient = llmClient;
        this.executor = executor;
        this.timeout = timeout;
    }

    public String generate(String prompt) throws IOException, InterruptedException {
        FutureTask<String> task = new FutureTask<>(() -> llmClient.sendPrompt(prompt));
        executor.execute(task);

        String text;
        try {
            text = task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.error("AI provider {} did not answer within {}s", llmClient.getActiveProvider(), timeout.toSeconds());
            throw new IOException("AI service did not respond within " + timeout.toSeconds() + " seconds", e);
        } catch (InterruptedException e) {
            task.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("AI provider {} call failed: {}", llmClient.getActiveProvider(), cause.getMessage());
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("AI service call failed: " + cause.getMessage(), cause);
        }

        if (text == null || text.isBlank()) {
            throw new IOException("AI model returned an empty response");
        }
        log.debug("AI response received. Length: {} characters", text.length());
        return text;
    }
}
