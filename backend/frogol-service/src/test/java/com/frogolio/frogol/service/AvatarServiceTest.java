package com.frogolio.frogol.service;

import com.frogolio.frogol.dto.ImageBatchResultDto;
import com.frogolio.frogol.entity.Frogol;
import com.frogolio.frogol.entity.FrogolAvatarImage;
import com.frogolio.frogol.exception.FrogolioException;
import com.frogolio.frogol.exception.InternalErrorException;
import com.frogolio.frogol.exception.UploadValidationException;
import com.frogolio.frogol.image.ImageBatchResult;
import com.frogolio.frogol.image.ImageStore;
import com.frogolio.frogol.image.StoredImage;
import com.frogolio.frogol.repository.FrogolAvatarImageRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AvatarService")
class AvatarServiceTest {

    @Mock
    private FrogolAvatarImageRepository avatarImageRepository;

    @Mock
    private FrogolService frogolService;

    @Mock
    private ImageStore imageStore;

    @InjectMocks
    private AvatarService avatarService;

    @Test
    @DisplayName("Should replace the old avatar and point the profile at the new one")
    void shouldUploadAvatar() {
        // Given
        Frogol frogol = Frogol.builder().id(UUID.randomUUID()).slug("frog").build();
        MultipartFile file = new MockMultipartFile("avatar", "me.png", "image/png", new byte[]{1});
        FrogolAvatarImage old = FrogolAvatarImage.builder().frogol(frogol).imageFilename("old.png").build();
        when(frogolService.getById(frogol.getId())).thenReturn(frogol);
        when(avatarImageRepository.findByFrogolId(frogol.getId())).thenReturn(List.of(old));
        when(imageStore.store(file, 0)).thenReturn(new StoredImage("new.png", "image/png", 0));
        when(imageStore.urlFor("new.png")).thenReturn("/static/avatars/new.png");

        // When
        String url = avatarService.uploadAvatar(frogol.getId(), file);

        // Then
        assertThat(url).isEqualTo("/static/avatars/new.png");
        InOrder inOrder = inOrder(imageStore, avatarImageRepository, frogolService);
        inOrder.verify(imageStore).store(file, 0);
        inOrder.verify(imageStore).delete("old.png");
        inOrder.verify(avatarImageRepository).deleteAllByFrogolId(frogol.getId());
        inOrder.verify(avatarImageRepository).save(any(FrogolAvatarImage.class));
        inOrder.verify(frogolService).updateAvatarUrl(frogol.getId(), "/static/avatars/new.png");
    }

    @Test
    @DisplayName("Should leave the current avatar untouched when the new file is rejected")
    void shouldKeepAvatarWhenUploadRejected() {
        // Given
        Frogol frogol = Frogol.builder().id(UUID.randomUUID()).slug("frog").build();
        MultipartFile file = new MockMultipartFile("avatar", "doc.pdf", "application/pdf", "%PDF-1.4".getBytes());
        when(frogolService.getById(frogol.getId())).thenReturn(frogol);
        when(imageStore.store(file, 0)).thenThrow(new UploadValidationException(
                "Unsupported image type: application/pdf. Only JPEG, PNG, GIF, and WebP are allowed."));

        // When / Then
        assertThatThrownBy(() -> avatarService.uploadAvatar(frogol.getId(), file))
                .isInstanceOf(UploadValidationException.class);
        verify(imageStore, never()).delete(any());
        verify(avatarImageRepository, never()).deleteAllByFrogolId(any());
        verify(avatarImageRepository, never()).save(any());
        verify(frogolService, never()).updateAvatarUrl(any(), any());
    }

    @Test
    @DisplayName("Should finish the replacement when an old file cannot be removed")
    void shouldReplaceAvatarDespiteStaleFile() {
        // Given
        Frogol frogol = Frogol.builder().id(UUID.randomUUID()).slug("frog").build();
        MultipartFile file = new MockMultipartFile("avatar", "me.png", "image/png", new byte[]{1});
        when(frogolService.getById(frogol.getId())).thenReturn(frogol);
        when(imageStore.store(file, 0)).thenReturn(new StoredImage("new.png", "image/png", 0));
        when(avatarImageRepository.findByFrogolId(frogol.getId()))
                .thenReturn(List.of(FrogolAvatarImage.builder().imageFilename("old.png").build()));
        doThrow(new InternalErrorException("Failed to delete image file: old.png")).when(imageStore).delete("old.png");
        when(imageStore.urlFor("new.png")).thenReturn("/static/avatars/new.png");

        // When
        String url = avatarService.uploadAvatar(frogol.getId(), file);

        // Then
        assertThat(url).isEqualTo("/static/avatars/new.png");
        verify(avatarImageRepository).deleteAllByFrogolId(frogol.getId());
        verify(frogolService).updateAvatarUrl(frogol.getId(), "/static/avatars/new.png");
    }

    @Test
    @DisplayName("Should keep deleting after a failed file and report the first failure")
    void shouldContinueDeleteAfterFailure() {
        // Given
        UUID frogolId = UUID.randomUUID();
        when(avatarImageRepository.findByFrogolId(frogolId)).thenReturn(List.of(
                FrogolAvatarImage.builder().imageFilename("a.png").build(),
                FrogolAvatarImage.builder().imageFilename("b.png").build(),
                FrogolAvatarImage.builder().imageFilename("c.png").build()));
        InternalErrorException first = new InternalErrorException("Failed to delete image file: a.png");
        doThrow(first).when(imageStore).delete("a.png");
        doThrow(new InternalErrorException("Failed to delete image file: b.png")).when(imageStore).delete("b.png");

        // When / Then
        assertThatThrownBy(() -> avatarService.deleteAvatar(frogolId)).isSameAs(first);
        verify(imageStore).delete("c.png");
        verify(avatarImageRepository).deleteAllByFrogolId(frogolId);
    }

    @Test
    @DisplayName("Should name the most recent avatar file")
    void shouldFindAvatarFilename() {
        UUID frogolId = UUID.randomUUID();
        when(avatarImageRepository.findFirstByFrogolIdOrderByCreatedAtDesc(frogolId))
                .thenReturn(Optional.of(FrogolAvatarImage.builder().imageFilename("latest.webp").build()));

        assertThat(avatarService.getAvatarFilename(frogolId)).contains("latest.webp");
    }

    @Test
    @DisplayName("Should do nothing when the frogol has no images")
    void shouldSkipDeleteWithoutImages() {
        UUID frogolId = UUID.randomUUID();
        when(avatarImageRepository.findByFrogolId(frogolId)).thenReturn(List.of());

        avatarService.deleteAvatar(frogolId);

        verifyNoInteractions(imageStore);
        verify(avatarImageRepository, never()).deleteAllByFrogolId(any());
    }

    @Test
    @DisplayName("Should record stored images of a batch and list the rejected ones")
    void shouldUploadBatch() {
        // Given
        Frogol frogol = Frogol.builder().id(UUID.randomUUID()).slug("frog").build();
        List<MultipartFile> files = List.of(
                new MockMultipartFile("images", "a.png", "image/png", new byte[]{1}),
                new MockMultipartFile("images", "b.txt", "text/plain", new byte[]{2}));
        when(frogolService.getById(frogol.getId())).thenReturn(frogol);
        when(avatarImageRepository.findByFrogolId(frogol.getId())).thenReturn(List.of());
        when(imageStore.storeBatch(files, 0)).thenReturn(new ImageBatchResult(
                List.of(new StoredImage("a1.png", "image/png", 0)),
                List.<FrogolioException>of(new UploadValidationException("Unsupported image type: text/plain. Only JPEG, PNG, GIF, and WebP are allowed."))));
        when(imageStore.urlFor("a1.png")).thenReturn("/static/avatars/a1.png");

        // When
        ImageBatchResultDto result = avatarService.uploadImages(frogol.getId(), files);

        // Then
        assertThat(result.getImageUrls()).containsExactly("/static/avatars/a1.png");
        assertThat(result.getErrors()).singleElement().asString().startsWith("Unsupported image type: text/plain");
        verify(avatarImageRepository).save(any(FrogolAvatarImage.class));
    }
}
