package com.ai.tutoring;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Tutoring sessions back end: session lifecycle, cancellation negotiation
 * and the AI lesson report pipeline (summary, quiz, grading).
 */
@SpringBootApplication
public class TutoringApplication {

    public static void main(String[] args) {
        SpringApplication.run(TutoringApplication.class, args);
    }
}
