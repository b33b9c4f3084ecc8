package com.ai.tutoring.service;

import com.ai.tutoring.exception.ContractViolationException;
import com.ai.tutoring.exception.ErrorCode;
import com.ai.tutoring.model.QuestionResult;
import com.ai.tutoring.model.QuestionType;
import com.ai.tutoring.model.QuizQuestion;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Deterministic, single-pass grading of a quiz submission.
 *
 * <p>Answers are trimmed before comparison. Multiple choice answers must
 * match the correct option exactly (case-sensitive); true/false answers
 * are compared ignoring case.</p>
 */
@Component
public class QuizGrader {

    /**
     * @param answers question index → answer; must hold a non-null answer for
     *                every index 0..n-1 and nothing else
     * @throws ContractViolationException INCOMPLETE_SUBMISSION otherwise
     */
    public GradingResult grade(List<QuizQuestion> questions, Map<Integer, String> answers) {
        requireComplete(questions.size(), answers);

        List<QuestionResult> results = new ArrayList<>(questions.size());
        int correctCount = 0;

        for (int i = 0; i < questions.size(); i++) {
            QuizQuestion question = questions.get(i);
            String studentAnswer = answers.get(i);
            boolean correct = isCorrect(question, studentAnswer);
            if (correct)
                correctCount++;

            results.add(QuestionResult.builder()
                    .questionIndex(i)
                    .question(question.getQuestion())
                    .studentAnswer(studentAnswer)
                    .correctAnswer(question.getCorrectAnswer())
                    .correct(correct)
                    .explanation(question.getExplanation())
                    .topic(question.getTopic())
                    .build());
        }

        return GradingResult.builder()
                .correctCount(correctCount)
                .totalQuestions(questions.size())
                .score(percentage(correctCount, questions.size()))
                .detailedResults(List.copyOf(results))
                .build();
    }

    static boolean isCorrect(QuizQuestion question, String studentAnswer) {
        String given = studentAnswer.trim();
        String expected = question.getCorrectAnswer().trim();
        return question.getType() == QuestionType.TRUE_FALSE
                ? given.equalsIgnoreCase(expected)
                : given.equals(expected);
    }

    static int percentage(int correctCount, int totalQuestions) {
        return BigDecimal.valueOf(correctCount * 100L)
                .divide(BigDecimal.valueOf(totalQuestions), 0, RoundingMode.HALF_UP)
                .intValue();
    }

    private static void requireComplete(int questionCount, Map<Integer, String> answers) {
        if (answers == null || answers.size() != questionCount) {
            throw new ContractViolationException(ErrorCode.INCOMPLETE_SUBMISSION,
                    "Expected answers for all " + questionCount + " questions, got "
                            + (answers == null ? 0 : answers.size()));
        }
        for (int i = 0; i < questionCount; i++) {
            if (answers.get(i) == null) {
                throw new ContractViolationException(ErrorCode.INCOMPLETE_SUBMISSION,
                        "Missing answer for question " + i);
            }
        }
    }
}
