package com.ai.tutoring.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Booking request. The session starts out pending until the tutor confirms it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {

    @NotBlank
    private String tutorId;

    @NotBlank
    private String studentId;

    private String subjectId;

    private String subjectName;

    private String studentName;

    @NotNull
    private LocalDateTime scheduledAt;

    /** Length of the lesson in minutes; 60 when omitted. */
    @Min(15)
    @Max(480)
    private Integer durationMinutes;

    @PositiveOrZero
    private long priceCents;

    private String notes;
}
