package com.frogolio.frogol.image;

import com.frogolio.frogol.exception.FrogolioException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Per-file outcome of a batch upload: what was stored and what was rejected
 */
@Getter
@AllArgsConstructor
public class ImageBatchResult {

    private final List<StoredImage> stored;
    private final List<FrogolioException> errors;
}
