package com.frogolio.frogol.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for adding a link to a frogol
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddLinkRequest {

    @NotBlank(message = "URL is required")
    @Size(max = 2048, message = "URL is too long")
    private String url;

    @NotBlank(message = "Label is required")
    private String label;
}
