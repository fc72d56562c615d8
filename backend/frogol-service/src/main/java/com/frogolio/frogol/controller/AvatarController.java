package com.frogolio.frogol.controller;

import com.frogolio.frogol.dto.ImageBatchResultDto;
import com.frogolio.frogol.entity.User;
import com.frogolio.frogol.exception.InvalidInputException;
import com.frogolio.frogol.security.CurrentUserResolver;
import com.frogolio.frogol.service.AvatarService;
import com.frogolio.frogol.service.FrogolService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for frogol avatar images
 */
@RestController
@RequestMapping("/api/frogol/{id}")
@RequiredArgsConstructor
@Tag(name = "Avatar", description = "Avatar and image upload APIs")
public class AvatarController {

    private final AvatarService avatarService;
    private final FrogolService frogolService;
    private final CurrentUserResolver currentUserResolver;

    @PostMapping(value = "/avatar", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload avatar", description = "Replace the avatar with a JPEG, PNG, GIF or WebP image up to 5MB")
    public ResponseEntity<Map<String, Object>> upload(@PathVariable UUID id,
                                                      @RequestParam(name = "avatar", required = false) MultipartFile avatar,
                                                      HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        frogolService.getOwnedFrogol(id, user.getId());
        if (avatar == null) {
            throw new InvalidInputException("No avatar field found in upload");
        }

        String avatarUrl = avatarService.uploadAvatar(id, avatar);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "avatarUrl", avatarUrl));
    }

    @DeleteMapping("/avatar")
    @Operation(summary = "Remove avatar", description = "Delete the avatar files and clear the avatar URL")
    public ResponseEntity<Void> delete(@PathVariable UUID id, HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        frogolService.getOwnedFrogol(id, user.getId());
        avatarService.deleteAvatar(id);
        frogolService.updateAvatarUrl(id, null);
        return ResponseEntity.noContent().build();
    }

    @PostMapping(value = "/images", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload images", description = "Store several images; rejected files are listed in errors")
    public ResponseEntity<ImageBatchResultDto> uploadImages(@PathVariable UUID id,
                                                            @RequestParam(name = "images", required = false) List<MultipartFile> images,
                                                            HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        frogolService.getOwnedFrogol(id, user.getId());
        if (images == null || images.isEmpty()) {
            throw new InvalidInputException("No images found in upload");
        }
        return ResponseEntity.ok(avatarService.uploadImages(id, images));
    }
}
