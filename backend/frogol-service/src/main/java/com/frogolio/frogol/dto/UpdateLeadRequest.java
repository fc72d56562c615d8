package com.frogolio.frogol.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for editing a lead
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateLeadRequest {

    @NotBlank(message = "Email is required")
    private String email;

    private String source;

    private Integer score;

    @Size(max = 2000, message = "Message is too long")
    private String message;
}
