package com.frogolio.frogol.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for editing a link; every field is optional
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateLinkRequest {

    @Size(max = 2048, message = "URL is too long")
    private String url;

    private String label;

    private Boolean isActive;
}
