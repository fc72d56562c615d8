package com.frogolio.frogol.service;

import com.frogolio.frogol.dto.ImageBatchResultDto;
import com.frogolio.frogol.entity.Frogol;
import com.frogolio.frogol.entity.FrogolAvatarImage;
import com.frogolio.frogol.exception.FrogolioException;
import com.frogolio.frogol.image.ImageBatchResult;
import com.frogolio.frogol.image.ImageStore;
import com.frogolio.frogol.image.StoredImage;
import com.frogolio.frogol.repository.FrogolAvatarImageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Avatar images of a frogol: files in the image store, metadata rows in the database
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AvatarService {

    private final FrogolAvatarImageRepository avatarImageRepository;
    private final FrogolService frogolService;
    private final ImageStore imageStore;

    /**
     * Replace the frogol's avatar with the uploaded file and return its public URL.
     * The previous images are only removed once the new file has been accepted.
     */
    @Transactional
    public String uploadAvatar(UUID frogolId, MultipartFile file) {
        Frogol frogol = frogolService.getById(frogolId);

        StoredImage stored = imageStore.store(file, 0);

        List<FrogolAvatarImage> previous = avatarImageRepository.findByFrogolId(frogolId);
        if (!previous.isEmpty()) {
            RuntimeException failure = removeImages(frogolId, previous);
            if (failure != null) {
                log.warn("Old avatar files of frogol {} were not all removed: {}", frogolId, failure.getMessage());
            }
        }

        avatarImageRepository.save(FrogolAvatarImage.builder()
                .frogol(frogol)
                .imageFilename(stored.getFilename())
                .build());

        String url = imageStore.urlFor(stored.getFilename());
        frogolService.updateAvatarUrl(frogolId, url);
        log.info("Stored avatar {} for frogol {}", stored.getFilename(), frogolId);
        return url;
    }

    @Transactional(readOnly = true)
    public Optional<String> getAvatarFilename(UUID frogolId) {
        return avatarImageRepository.findFirstByFrogolIdOrderByCreatedAtDesc(frogolId)
                .map(FrogolAvatarImage::getImageFilename);
    }

    /**
     * Remove every image file of the frogol, then the metadata rows.
     * Keeps going past failures and rethrows the first one at the end; removed rows stay removed.
     */
    @Transactional(noRollbackFor = FrogolioException.class)
    public void deleteAvatar(UUID frogolId) {
        List<FrogolAvatarImage> images = avatarImageRepository.findByFrogolId(frogolId);
        if (images.isEmpty()) {
            return;
        }

        RuntimeException failure = removeImages(frogolId, images);
        if (failure != null) {
            throw failure;
        }
        log.info("Removed {} avatar image(s) of frogol {}", images.size(), frogolId);
    }

    private RuntimeException removeImages(UUID frogolId, List<FrogolAvatarImage> images) {
        RuntimeException firstFailure = null;
        for (FrogolAvatarImage image : images) {
            try {
                imageStore.delete(image.getImageFilename());
            } catch (FrogolioException e) {
                log.error("Failed to delete avatar file {} of frogol {}", image.getImageFilename(), frogolId, e);
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        try {
            avatarImageRepository.deleteAllByFrogolId(frogolId);
        } catch (DataAccessException e) {
            log.error("Failed to delete avatar records of frogol {}", frogolId, e);
            if (firstFailure == null) {
                firstFailure = e;
            }
        }
        return firstFailure;
    }

    /**
     * Store several images at once. Files that fail validation are reported
     * per file and do not stop the others.
     */
    @Transactional
    public ImageBatchResultDto uploadImages(UUID frogolId, List<MultipartFile> files) {
        Frogol frogol = frogolService.getById(frogolId);
        int startingOrder = avatarImageRepository.findByFrogolId(frogolId).size();

        ImageBatchResult result = imageStore.storeBatch(files, startingOrder);

        for (StoredImage stored : result.getStored()) {
            avatarImageRepository.save(FrogolAvatarImage.builder()
                    .frogol(frogol)
                    .imageFilename(stored.getFilename())
                    .build());
        }
        if (!result.getErrors().isEmpty()) {
            log.warn("{} of {} images rejected for frogol {}", result.getErrors().size(), files.size(), frogolId);
        }

        return ImageBatchResultDto.builder()
                .imageUrls(result.getStored().stream()
                        .map(stored -> imageStore.urlFor(stored.getFilename()))
                        .collect(Collectors.toList()))
                .errors(result.getErrors().stream()
                        .map(FrogolioException::getMessage)
                        .collect(Collectors.toList()))
                .build();
    }
}
