package com.ai.tutoring.dto;

import com.ai.tutoring.model.Party;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/sessions/{id}/cancel-request}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancelRequest {

    /** The party asking to cancel. */
    @NotNull
    private Party role;
}
