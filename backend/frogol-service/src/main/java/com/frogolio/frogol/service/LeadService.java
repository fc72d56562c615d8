package com.frogolio.frogol.service;

import com.frogolio.frogol.dto.LeadDto;
import com.frogolio.frogol.entity.Frogol;
import com.frogolio.frogol.entity.Lead;
import com.frogolio.frogol.entity.LeadSource;
import com.frogolio.frogol.exception.ForbiddenException;
import com.frogolio.frogol.exception.InvalidInputException;
import com.frogolio.frogol.exception.ResourceNotFoundException;
import com.frogolio.frogol.repository.FrogolRepository;
import com.frogolio.frogol.repository.LeadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Lead capture from public pages and lead management for owners
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeadService {

    private final LeadRepository leadRepository;
    private final FrogolRepository frogolRepository;

    // ==================== Capture ====================

    /**
     * Store a visitor's email against a frogol, scored by where the visitor came from
     */
    @Transactional
    public Lead captureLead(UUID frogolId, String email, String source, String message) {
        validateEmail(email);

        Frogol frogol = frogolRepository.findById(frogolId)
                .orElseThrow(() -> new ResourceNotFoundException("Frogol not found: " + frogolId));

        Lead lead = Lead.builder()
                .frogol(frogol)
                .email(email.trim())
                .source(source)
                .score(LeadSource.scoreFor(source))
                .message(message)
                .build();

        lead = leadRepository.save(lead);
        log.info("Captured lead {} for frogol {} (score {})", lead.getId(), frogolId, lead.getScore());
        return lead;
    }

    // ==================== Management ====================

    @Transactional(readOnly = true)
    public List<LeadDto> getFrogolLeads(UUID frogolId) {
        return leadRepository.findByFrogolIdOrderByCreatedAtDesc(frogolId).stream()
                .map(LeadDto::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public long getUserTotalLeads(UUID userId) {
        return leadRepository.countByOwnerId(userId);
    }

    @Transactional(readOnly = true)
    public Lead getLead(UUID leadId) {
        return leadRepository.findById(leadId)
                .orElseThrow(() -> new ResourceNotFoundException("Lead not found: " + leadId));
    }

    @Transactional(readOnly = true)
    public Lead getOwnedLead(UUID leadId, UUID userId) {
        Lead lead = getLead(leadId);
        if (!lead.getFrogol().isOwnedBy(userId)) {
            throw new ForbiddenException("Not the owner of this lead");
        }
        return lead;
    }

    /**
     * Overwrite a lead's fields; score is taken as given, not recomputed
     */
    @Transactional
    public Lead updateLead(UUID leadId, String email, String source, Integer score, String message) {
        validateEmail(email);

        Lead lead = getLead(leadId);
        lead.setEmail(email.trim());
        lead.setSource(source);
        lead.setScore(score);
        lead.setMessage(message);
        return leadRepository.save(lead);
    }

    @Transactional
    public void deleteLead(UUID leadId) {
        Lead lead = getLead(leadId);
        leadRepository.delete(lead);
        log.debug("Deleted lead {}", leadId);
    }

    private static void validateEmail(String email) {
        if (email == null || !email.contains("@")) {
            throw new InvalidInputException("Invalid email format");
        }
    }
}
