package com.ai.tutoring.service;

import com.ai.tutoring.exception.ErrorCode;
import com.ai.tutoring.exception.GenerationFailedException;
import com.ai.tutoring.model.Difficulty;
import com.ai.tutoring.model.QuestionType;
import com.ai.tutoring.model.QuizQuestion;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates a quiz reply from the AI provider. Validation is all-or-nothing:
 * a single bad question rejects the whole payload.
 *
 * <p>Per question: text, correct answer, explanation and topic must be
 * non-blank; a multiple-choice question needs a non-empty option list that
 * contains the correct answer verbatim; a true/false question's answer must be
 * "true" or "false" in any case.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeneratedQuizParser {

    static final List<String> DEFAULT_FOCUS_AREAS = List.of("General Review");

    private final JsonReplyReader jsonReplyReader;

    public GeneratedQuiz parse(String rawResponse) {
        JsonNode root = jsonReplyReader.readObject(rawResponse, ErrorCode.QUIZ_GENERATION_FAILED);

        JsonNode questionsNode = root.get("questions");
        if (questionsNode == null || !questionsNode.isArray() || questionsNode.isEmpty()) {
            throw reject("AI response missing or invalid questions");
        }

        List<QuizQuestion> questions = new ArrayList<>();
        for (int i = 0; i < questionsNode.size(); i++) {
            questions.add(parseQuestion(questionsNode.get(i), i));
        }

        return GeneratedQuiz.builder()
                .questions(List.copyOf(questions))
                .focusAreas(parseFocusAreas(root.get("focusAreas")))
                .difficulty(parseDifficulty(root.get("difficulty")))
                .build();
    }

    private QuizQuestion parseQuestion(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw reject("Question " + index + " is not an object");
        }

        String text = JsonReplyReader.nonBlankText(node, "question");
        String correctAnswer = JsonReplyReader.nonBlankText(node, "correctAnswer");
        String explanation = JsonReplyReader.nonBlankText(node, "explanation");
        String topic = JsonReplyReader.nonBlankText(node, "topic");
        if (text == null || correctAnswer == null || explanation == null || topic == null) {
            throw reject("Invalid question format in AI response (question " + index + ")");
        }

        QuestionType type = QuestionType.fromWireName(JsonReplyReader.nonBlankText(node, "type"))
                .orElseThrow(() -> reject("Question " + index + " has an unknown type"));

        List<String> options = null;
        if (type == QuestionType.MULTIPLE_CHOICE) {
            options = parseOptions(node.get("options"), index);
            if (!options.contains(correctAnswer)) {
                throw reject("Question " + index + ": correct answer is not one of the options");
            }
        } else if ("true".equalsIgnoreCase(correctAnswer) || "false".equalsIgnoreCase(correctAnswer)) {
            correctAnswer = correctAnswer.toLowerCase();
        } else {
            throw reject("Question " + index + ": true/false answer must be \"true\" or \"false\"");
        }

        return QuizQuestion.builder()
                .question(text)
                .type(type)
                .options(options)
                .correctAnswer(correctAnswer)
                .explanation(explanation)
                .topic(topic)
                .build();
    }

    private List<String> parseOptions(JsonNode node, int index) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw reject("Multiple choice question " + index + " has no options");
        }
        List<String> options = new ArrayList<>();
        for (JsonNode option : node) {
            if (!option.isTextual() || option.asText().isBlank()) {
                throw reject("Multiple choice question " + index + " has an empty option");
            }
            options.add(option.asText().trim());
        }
        return List.copyOf(options);
    }

    private List<String> parseFocusAreas(JsonNode node) {
        if (node == null || !node.isArray())
            return DEFAULT_FOCUS_AREAS;
        List<String> areas = new ArrayList<>();
        for (JsonNode area : node) {
            if (area.isTextual() && !area.asText().isBlank())
                areas.add(area.asText().trim());
        }
        return areas.isEmpty() ? DEFAULT_FOCUS_AREAS : List.copyOf(areas);
    }

    private Difficulty parseDifficulty(JsonNode node) {
        if (node == null || node.isNull())
            return Difficulty.MEDIUM;
        Optional<Difficulty> difficulty = node.isTextual()
                ? Difficulty.fromWireName(node.asText())
                : Optional.empty();
        return difficulty.orElseThrow(() -> reject("Unknown quiz difficulty: " + node));
    }

    private GenerationFailedException reject(String reason) {
        log.warn("Rejected AI quiz payload: {}", reason);
        return new GenerationFailedException(ErrorCode.QUIZ_GENERATION_FAILED, reason);
    }
}
