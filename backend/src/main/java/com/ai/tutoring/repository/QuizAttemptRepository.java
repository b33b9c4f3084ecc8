package com.ai.tutoring.repository;

import com.ai.tutoring.model.QuizAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface QuizAttemptRepository extends JpaRepository<QuizAttempt, String> {

    boolean existsByQuizId(String quizId);

    /** The retrievable (most recent) attempt of a student. */
    Optional<QuizAttempt> findFirstByQuizIdAndStudentIdOrderByAttemptNumberDesc(String quizId, String studentId);

    /** Full history, newest first. */
    List<QuizAttempt> findByQuizIdAndStudentIdOrderByAttemptNumberDesc(String quizId, String studentId);
}
