package com.frogolio.frogol.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a frogol; the slug is normalized server side
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateFrogolRequest {

    @NotBlank(message = "Display name is required")
    @Size(max = 255, message = "Display name is too long")
    private String displayName;

    @NotBlank(message = "Slug is required")
    private String slug;
}
