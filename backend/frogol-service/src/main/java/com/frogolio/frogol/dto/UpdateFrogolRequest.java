package com.frogolio.frogol.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for editing a frogol; null avatarUrl or bio keeps the stored value
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateFrogolRequest {

    @NotBlank(message = "Display name is required")
    @Size(max = 255, message = "Display name is too long")
    private String displayName;

    @NotBlank(message = "Theme is required")
    private String theme;

    private String avatarUrl;

    @Size(max = 2000, message = "Bio is too long")
    private String bio;
}
