package com.frogolio.frogol.controller;

import com.frogolio.frogol.dto.ImageBatchResultDto;
import com.frogolio.frogol.entity.Frogol;
import com.frogolio.frogol.entity.User;
import com.frogolio.frogol.exception.UploadValidationException;
import com.frogolio.frogol.security.CurrentUserResolver;
import com.frogolio.frogol.service.AvatarService;
import com.frogolio.frogol.service.FrogolService;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AvatarController.class)
@DisplayName("AvatarController")
class AvatarControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AvatarService avatarService;

    @MockBean
    private FrogolService frogolService;

    @MockBean
    private CurrentUserResolver currentUserResolver;

    private Frogol frogol;

    @BeforeEach
    void setUp() {
        User user = User.builder().id(UUID.randomUUID()).email("frog@example.com").build();
        frogol = Frogol.builder().id(UUID.randomUUID()).user(user).slug("frog").build();
        when(currentUserResolver.requireUser(any(HttpServletRequest.class))).thenReturn(user);
        when(frogolService.getOwnedFrogol(frogol.getId(), user.getId())).thenReturn(frogol);
    }

    @Test
    @DisplayName("Should upload an avatar and return its URL")
    void shouldUploadAvatar() throws Exception {
        when(avatarService.uploadAvatar(eq(frogol.getId()), any())).thenReturn("/static/avatars/new.png");

        mockMvc.perform(multipart("/api/frogol/" + frogol.getId() + "/avatar")
                        .file(new MockMultipartFile("avatar", "me.png", "image/png", new byte[]{1, 2, 3})))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.avatarUrl").value("/static/avatars/new.png"));
    }

    @Test
    @DisplayName("Should surface upload validation messages as 400")
    void shouldRejectInvalidUpload() throws Exception {
        when(avatarService.uploadAvatar(eq(frogol.getId()), any()))
                .thenThrow(new UploadValidationException("Unsupported image type: text/plain. Only JPEG, PNG, GIF, and WebP are allowed."));

        mockMvc.perform(multipart("/api/frogol/" + frogol.getId() + "/avatar")
                        .file(new MockMultipartFile("avatar", "x.txt", "text/plain", new byte[]{1})))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unsupported image type: text/plain. Only JPEG, PNG, GIF, and WebP are allowed."));
    }

    @Test
    @DisplayName("Should reject an upload without the avatar field")
    void shouldRequireAvatarField() throws Exception {
        mockMvc.perform(multipart("/api/frogol/" + frogol.getId() + "/avatar")
                        .file(new MockMultipartFile("other", "me.png", "image/png", new byte[]{1})))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No avatar field found in upload"));
        verifyNoInteractions(avatarService);
    }

    @Test
    @DisplayName("Should remove the avatar and clear the profile URL")
    void shouldDeleteAvatar() throws Exception {
        mockMvc.perform(delete("/api/frogol/" + frogol.getId() + "/avatar"))
                .andExpect(status().isNoContent());

        verify(avatarService).deleteAvatar(frogol.getId());
        verify(frogolService).updateAvatarUrl(frogol.getId(), null);
    }

    @Test
    @DisplayName("Should report stored and rejected files of a batch")
    void shouldUploadBatch() throws Exception {
        when(avatarService.uploadImages(eq(frogol.getId()), anyList())).thenReturn(ImageBatchResultDto.builder()
                .imageUrls(List.of("/static/avatars/a.png"))
                .errors(List.of("Image b.png is empty"))
                .build());

        mockMvc.perform(multipart("/api/frogol/" + frogol.getId() + "/images")
                        .file(new MockMultipartFile("images", "a.png", "image/png", new byte[]{1}))
                        .file(new MockMultipartFile("images", "b.png", "image/png", new byte[0])))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imageUrls[0]").value("/static/avatars/a.png"))
                .andExpect(jsonPath("$.errors[0]").value("Image b.png is empty"));
    }
}
