package com.ai.tutoring.service;

import com.ai.tutoring.exception.ErrorCode;
import com.ai.tutoring.exception.GenerationFailedException;
import com.ai.tutoring.model.Difficulty;
import com.ai.tutoring.model.QuestionType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeneratedQuizParserTest {

    private final GeneratedQuizParser parser = new GeneratedQuizParser(new JsonReplyReader(new ObjectMapper()));

    private static final String VALID = """
            Here is your quiz:
            ```json
            {
              "questions": [
                {
                  "question": "What is 1/2 + 1/4?",
                  "type": "multiple_choice",
                  "options": ["1/6", "3/4", "2/6", "1"],
                  "correctAnswer": "3/4",
                  "explanation": "Use a common denominator.",
                  "topic": "Fractions"
                },
                {
                  "question": "A denominator can be zero.",
                  "type": "TRUE_FALSE",
                  "correctAnswer": "False",
                  "explanation": "Division by zero is undefined.",
                  "topic": "Fractions"
                }
              ],
              "focusAreas": ["Common denominators"],
              "difficulty": "Hard"
            }
            ```
            """;

    @Test
    @DisplayName("parse: valid payload inside prose is accepted and normalized")
    void parse_valid() {
        GeneratedQuiz quiz = parser.parse(VALID);

        assertEquals(2, quiz.getQuestions().size());
        assertEquals(QuestionType.MULTIPLE_CHOICE, quiz.getQuestions().get(0).getType());
        assertEquals(QuestionType.TRUE_FALSE, quiz.getQuestions().get(1).getType());
        assertEquals("false", quiz.getQuestions().get(1).getCorrectAnswer());
        assertEquals(List.of("Common denominators"), quiz.getFocusAreas());
        assertEquals(Difficulty.HARD, quiz.getDifficulty());
    }

    @Test
    @DisplayName("parse: missing focus areas and difficulty fall back to defaults")
    void parse_defaults() {
        GeneratedQuiz quiz = parser.parse("""
                {"questions": [{"question": "Q", "type": "true_false", "correctAnswer": "true",
                                "explanation": "E", "topic": "T"}]}
                """);

        assertEquals(GeneratedQuizParser.DEFAULT_FOCUS_AREAS, quiz.getFocusAreas());
        assertEquals(Difficulty.MEDIUM, quiz.getDifficulty());
    }

    @Test
    @DisplayName("parse: correct answer not among the options rejects the whole quiz")
    void parse_answerNotInOptions_rejected() {
        GenerationFailedException ex = assertThrows(GenerationFailedException.class, () -> parser.parse("""
                {"questions": [
                  {"question": "Q1", "type": "true_false", "correctAnswer": "true", "explanation": "E", "topic": "T"},
                  {"question": "Q2", "type": "multiple_choice", "options": ["a", "b"], "correctAnswer": "c",
                   "explanation": "E", "topic": "T"}
                ]}
                """));
        assertEquals(ErrorCode.QUIZ_GENERATION_FAILED, ex.getErrorCode());
    }

    @Test
    @DisplayName("parse: rejects bad true/false answers, empty options, unknown types and empty lists")
    void parse_invalidShapes_rejected() {
        assertThrows(GenerationFailedException.class, () -> parser.parse("""
                {"questions": [{"question": "Q", "type": "true_false", "correctAnswer": "yes",
                                "explanation": "E", "topic": "T"}]}
                """));
        assertThrows(GenerationFailedException.class, () -> parser.parse("""
                {"questions": [{"question": "Q", "type": "multiple_choice", "options": [],
                                "correctAnswer": "a", "explanation": "E", "topic": "T"}]}
                """));
        assertThrows(GenerationFailedException.class, () -> parser.parse("""
                {"questions": [{"question": "Q", "type": "essay", "correctAnswer": "a",
                                "explanation": "E", "topic": "T"}]}
                """));
        assertThrows(GenerationFailedException.class, () -> parser.parse("{\"questions\": []}"));
        assertThrows(GenerationFailedException.class, () -> parser.parse("no json here"));
    }

    @Test
    @DisplayName("parse: unknown difficulty is rejected")
    void parse_unknownDifficulty_rejected() {
        assertThrows(GenerationFailedException.class, () -> parser.parse("""
                {"questions": [{"question": "Q", "type": "true_false", "correctAnswer": "true",
                                "explanation": "E", "topic": "T"}],
                 "difficulty": "extreme"}
                """));
    }
}
