package com.ai.tutoring.service;

import com.ai.tutoring.model.TutoringSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Default {@link SessionNotifier}: records notifications in the application
 * log on the notification pool. Replace with a push or e-mail adapter by
 * declaring another {@code SessionNotifier} bean.
 */
@Slf4j
@Component
public class LoggingSessionNotifier implements SessionNotifier {

    @Async("notificationExecutor")
    @Override
    public void sessionCompleted(TutoringSession session) {
        log.info("[notify] SESSION_COMPLETED session={} tutor={} student={}",
                session.getId(), session.getTutorId(), session.getStudentId());
    }

    @Async("notificationExecutor")
    @Override
    public void sessionCancelled(TutoringSession session) {
        log.info("[notify] SESSION_CANCELLED session={} tutor={} student={}",
                session.getId(), session.getTutorId(), session.getStudentId());
    }

    @Async("notificationExecutor")
    @Override
    public void lessonReportReady(TutoringSession session, boolean quizAvailable) {
        log.info("[notify] LESSON_REPORT_READY session={} student={} quiz={}",
                session.getId(), session.getStudentId(), quizAvailable);
    }
}
