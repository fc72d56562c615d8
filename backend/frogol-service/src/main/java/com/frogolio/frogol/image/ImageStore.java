package com.frogolio.frogol.image;

import com.frogolio.frogol.exception.FrogolioException;
import com.frogolio.frogol.exception.InternalErrorException;
import com.frogolio.frogol.exception.UploadValidationException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Validates uploaded images and keeps them on the local filesystem.
 *
 * <p>Batch operations run on two fixed-size pools so a request carrying many files
 * never has more than a handful of saves or deletions in flight.
 */
@Component
@Slf4j
public class ImageStore {

    private static final Map<String, String> EXTENSIONS = Map.of(
            "image/jpeg", "jpg",
            "image/png", "png",
            "image/gif", "gif",
            "image/webp", "webp");

    public static final Set<String> ALLOWED_TYPES = EXTENSIONS.keySet();

    private static final String OCTET_STREAM = "application/octet-stream";

    private final Path directory;
    private final String urlPrefix;
    private final long maxSizeBytes;
    private final ExecutorService processingPool;
    private final ExecutorService deletionPool;

    public ImageStore(@Value("${frogolio.images.dir:static/avatars}") String directory,
                      @Value("${frogolio.images.url-prefix:/static/avatars}") String urlPrefix,
                      @Value("${frogolio.images.max-size-bytes:5242880}") long maxSizeBytes,
                      @Value("${frogolio.images.processing-concurrency:4}") int processingConcurrency,
                      @Value("${frogolio.images.deletion-concurrency:8}") int deletionConcurrency) {
        this.directory = Paths.get(directory).toAbsolutePath().normalize();
        this.urlPrefix = urlPrefix.endsWith("/") ? urlPrefix.substring(0, urlPrefix.length() - 1) : urlPrefix;
        this.maxSizeBytes = maxSizeBytes;
        this.processingPool = Executors.newFixedThreadPool(processingConcurrency);
        this.deletionPool = Executors.newFixedThreadPool(deletionConcurrency);
    }

    public String urlFor(String filename) {
        return urlPrefix + "/" + filename;
    }

    // ==================== Single files ====================

    /**
     * Validate and save one upload under a fresh unique name
     */
    public StoredImage store(MultipartFile file, int order) {
        String originalName = file.getOriginalFilename() != null && !file.getOriginalFilename().isBlank()
                ? file.getOriginalFilename()
                : "unknown_image.bin";

        if (file.isEmpty()) {
            throw new UploadValidationException("Image " + originalName + " is empty");
        }
        if (file.getSize() > maxSizeBytes) {
            throw new UploadValidationException("File size must be less than " + (maxSizeBytes / (1024 * 1024)) + "MB");
        }

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            log.error("Failed to read upload {}", originalName, e);
            throw new UploadValidationException("Failed to read uploaded image for type checking.");
        }

        String contentType = effectiveContentType(file.getContentType(), content, originalName);
        if (!ALLOWED_TYPES.contains(contentType)) {
            log.warn("Uploaded image {} has unsupported type {} (client: {})", originalName, contentType, file.getContentType());
            throw new UploadValidationException("Unsupported image type: " + contentType
                    + ". Only JPEG, PNG, GIF, and WebP are allowed.");
        }

        // the extension follows the validated type, never the client's filename
        String uniqueName = UUID.randomUUID() + "." + EXTENSIONS.get(contentType);

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.error("Failed to create image directory {}", directory, e);
            throw new InternalErrorException("Failed to prepare image storage.", e);
        }
        try {
            Files.write(directory.resolve(uniqueName), content);
        } catch (IOException e) {
            log.error("Failed to write image {}", uniqueName, e);
            throw new InternalErrorException("Failed to save uploaded image.", e);
        }

        log.debug("Stored image {} as {} ({})", originalName, uniqueName, contentType);
        return new StoredImage(uniqueName, contentType, order);
    }

    /**
     * Remove one stored file; a file that is already gone only logs a warning
     */
    public void delete(String filename) {
        Path target = directory.resolve(filename).normalize();
        if (!target.startsWith(directory)) {
            throw new InternalErrorException("Failed to delete image file: " + filename);
        }
        if (!Files.exists(target)) {
            log.warn("Image file {} not found for deletion", filename);
            return;
        }
        try {
            Files.delete(target);
            log.info("Deleted image file {}", filename);
        } catch (IOException e) {
            log.warn("Failed to delete image file {}: {}", filename, e.getMessage());
            throw new InternalErrorException("Failed to delete image file: " + filename, e);
        }
    }

    // ==================== Batches ====================

    public ImageBatchResult storeBatch(List<MultipartFile> files, int startingOrder) {
        List<CompletableFuture<StoredImage>> futures = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            MultipartFile file = files.get(i);
            int index = i;
            int order = startingOrder + i;
            futures.add(CompletableFuture.supplyAsync(() -> {
                if (file.getOriginalFilename() == null) {
                    throw new UploadValidationException("Image at index " + index + " has no filename");
                }
                if (file.getOriginalFilename().isEmpty() && file.getContentType() == null) {
                    throw new UploadValidationException("Image at index " + index + " has empty filename and no content type");
                }
                return store(file, order);
            }, processingPool));
        }

        List<StoredImage> stored = new ArrayList<>();
        List<FrogolioException> errors = new ArrayList<>();
        for (CompletableFuture<StoredImage> future : futures) {
            try {
                stored.add(future.join());
            } catch (CompletionException e) {
                errors.add(unwrap(e));
            }
        }
        return new ImageBatchResult(stored, errors);
    }

    /**
     * Delete every file, continuing past failures; returns the failures
     */
    public List<FrogolioException> deleteBatch(List<String> filenames) {
        List<CompletableFuture<Void>> futures = new ArrayList<>(filenames.size());
        for (String filename : filenames) {
            futures.add(CompletableFuture.runAsync(() -> delete(filename), deletionPool));
        }

        List<FrogolioException> errors = new ArrayList<>();
        for (CompletableFuture<Void> future : futures) {
            try {
                future.join();
            } catch (CompletionException e) {
                errors.add(unwrap(e));
            }
        }
        return errors;
    }

    @PreDestroy
    public void shutdown() {
        processingPool.shutdown();
        deletionPool.shutdown();
    }

    private String effectiveContentType(String clientType, byte[] content, String originalName) {
        if (clientType != null && !clientType.isBlank() && !OCTET_STREAM.equals(clientType)) {
            return clientType;
        }
        String inferred = ImageTypeDetector.detect(content).orElseThrow(() -> {
            log.warn("Could not infer image type for {}", originalName);
            return new UploadValidationException("Could not determine image type. Please upload a valid image.");
        });
        log.info("Inferred image type for {}: {}", originalName, inferred);
        return inferred;
    }

    private static FrogolioException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof FrogolioException) {
            return (FrogolioException) cause;
        }
        log.error("Unexpected image task failure", cause);
        return new InternalErrorException("Failed to process image.", cause);
    }
}
