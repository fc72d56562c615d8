package com.frogolio.frogol.service;

import com.frogolio.frogol.entity.Frogol;
import com.frogolio.frogol.entity.Lead;
import com.frogolio.frogol.entity.User;
import com.frogolio.frogol.exception.ForbiddenException;
import com.frogolio.frogol.exception.InvalidInputException;
import com.frogolio.frogol.exception.ResourceNotFoundException;
import com.frogolio.frogol.repository.FrogolRepository;
import com.frogolio.frogol.repository.LeadRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LeadService")
class LeadServiceTest {

    @Mock
    private LeadRepository leadRepository;

    @Mock
    private FrogolRepository frogolRepository;

    @InjectMocks
    private LeadService leadService;

    @Test
    @DisplayName("Should capture a lead scored by its source")
    void shouldCaptureLead() {
        // Given
        Frogol frogol = frogol();
        when(frogolRepository.findById(frogol.getId())).thenReturn(Optional.of(frogol));
        when(leadRepository.save(any(Lead.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        Lead lead = leadService.captureLead(frogol.getId(), " visitor@example.com ", "referral", "hi");

        // Then
        assertThat(lead.getEmail()).isEqualTo("visitor@example.com");
        assertThat(lead.getScore()).isEqualTo(90);
        assertThat(lead.getFrogol()).isSameAs(frogol);
    }

    @Test
    @DisplayName("Should give leads without a known source the default score")
    void shouldScoreUnknownSource() {
        Frogol frogol = frogol();
        when(frogolRepository.findById(frogol.getId())).thenReturn(Optional.of(frogol));
        when(leadRepository.save(any(Lead.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThat(leadService.captureLead(frogol.getId(), "v@example.com", null, null).getScore()).isEqualTo(70);
    }

    @Test
    @DisplayName("Should reject an email without @ before any lookup")
    void shouldRejectInvalidEmail() {
        assertThatThrownBy(() -> leadService.captureLead(UUID.randomUUID(), "not-an-email", "direct", null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Invalid email format");
        verifyNoInteractions(frogolRepository, leadRepository);
    }

    @Test
    @DisplayName("Should report an unknown frogol as not found")
    void shouldRejectUnknownFrogol() {
        UUID frogolId = UUID.randomUUID();
        when(frogolRepository.findById(frogolId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> leadService.captureLead(frogolId, "v@example.com", "direct", null))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(leadRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should store the score given on update")
    void shouldUpdateLeadWithGivenScore() {
        Lead lead = Lead.builder().id(UUID.randomUUID()).frogol(frogol()).email("a@b.c").source("direct").score(100).build();
        when(leadRepository.findById(lead.getId())).thenReturn(Optional.of(lead));
        when(leadRepository.save(lead)).thenReturn(lead);

        Lead updated = leadService.updateLead(lead.getId(), "new@b.c", "social", 5, "note");

        assertThat(updated.getEmail()).isEqualTo("new@b.c");
        assertThat(updated.getSource()).isEqualTo("social");
        assertThat(updated.getScore()).isEqualTo(5);
        assertThat(updated.getMessage()).isEqualTo("note");
    }

    @Test
    @DisplayName("Should forbid access to a lead of someone else's frogol")
    void shouldForbidForeignLead() {
        Lead lead = Lead.builder().id(UUID.randomUUID()).frogol(frogol()).email("a@b.c").build();
        when(leadRepository.findById(lead.getId())).thenReturn(Optional.of(lead));

        assertThatThrownBy(() -> leadService.getOwnedLead(lead.getId(), UUID.randomUUID()))
                .isInstanceOf(ForbiddenException.class);
    }

    private static Frogol frogol() {
        User owner = User.builder().id(UUID.randomUUID()).email("frog@example.com").build();
        return Frogol.builder().id(UUID.randomUUID()).user(owner).slug("frog").build();
    }
}
