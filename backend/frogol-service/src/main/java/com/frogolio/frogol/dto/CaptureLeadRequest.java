package com.frogolio.frogol.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a visitor leaving their email on a frogol
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CaptureLeadRequest {

    @NotBlank(message = "Email is required")
    private String email;

    private String source;

    @Size(max = 2000, message = "Message is too long")
    private String message;
}
