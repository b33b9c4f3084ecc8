package com.ai.tutoring.dto;

import com.ai.tutoring.model.CancellationDecision;
import com.ai.tutoring.model.Party;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/sessions/{id}/cancel-response}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancelResponseRequest {

    /** The party answering the other side's request. */
    @NotNull
    private Party role;

    @NotNull
    private CancellationDecision decision;
}
