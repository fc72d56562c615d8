package com.frogolio.frogol.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.List;

/**
 * Outcome of a multi-file image upload
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImageBatchResultDto {

    private List<String> imageUrls;
    private List<String> errors;
}
