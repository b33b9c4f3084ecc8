package com.ai.tutoring.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutoCompleteResponse {

    /** Open sessions that started before the cutoff. */
    private int checked;

    /** Sessions whose slot had ended and were moved to completed. */
    private int completed;

    private LocalDateTime cutoff;
}
