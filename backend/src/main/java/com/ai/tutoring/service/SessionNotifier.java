package com.ai.tutoring.service;

import com.ai.tutoring.model.TutoringSession;

/**
 * Outbound notifications about session events. Delivery is fire-and-forget:
 * implementations must not block the caller and failures never undo the
 * state change that triggered them.
 */
public interface SessionNotifier {

    void sessionCompleted(TutoringSession session);

    void sessionCancelled(TutoringSession session);

    /**
     * A lesson report (summary, and the quiz when one was generated) is
     * available to the student.
     */
    void lessonReportReady(TutoringSession session, boolean quizAvailable);
}
