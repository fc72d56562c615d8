package com.frogolio.frogol.image;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * An image written to the store
 */
@Getter
@ToString
@AllArgsConstructor
public class StoredImage {

    private final String filename;
    private final String contentType;
    private final int order;
}
