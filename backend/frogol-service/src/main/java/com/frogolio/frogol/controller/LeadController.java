package com.frogolio.frogol.controller;

import com.frogolio.frogol.dto.CaptureLeadRequest;
import com.frogolio.frogol.dto.LeadDto;
import com.frogolio.frogol.dto.UpdateLeadRequest;
import com.frogolio.frogol.entity.Lead;
import com.frogolio.frogol.entity.User;
import com.frogolio.frogol.security.CurrentUserResolver;
import com.frogolio.frogol.service.LeadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * REST API for leads
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Lead", description = "Lead capture and management APIs")
public class LeadController {

    private final LeadService leadService;
    private final CurrentUserResolver currentUserResolver;

    @PostMapping("/lead/{frogolId}")
    @Operation(summary = "Capture lead", description = "Leave an email on a frogol page")
    public ResponseEntity<Map<String, Object>> capture(@PathVariable UUID frogolId,
                                                       @Valid @RequestBody CaptureLeadRequest request) {
        Lead lead = leadService.captureLead(frogolId, request.getEmail(), request.getSource(), request.getMessage());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "success", true,
                "leadId", lead.getId()));
    }

    @GetMapping("/leads/{id}")
    @Operation(summary = "Get lead", description = "Get a lead captured on one of the caller's frogols")
    public ResponseEntity<LeadDto> get(@PathVariable UUID id, HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        return ResponseEntity.ok(LeadDto.from(leadService.getOwnedLead(id, user.getId())));
    }

    @PutMapping("/leads/{id}")
    @Operation(summary = "Update lead", description = "Overwrite a lead's email, source, score and message")
    public ResponseEntity<LeadDto> update(@PathVariable UUID id,
                                          @Valid @RequestBody UpdateLeadRequest request,
                                          HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        leadService.getOwnedLead(id, user.getId());
        Lead lead = leadService.updateLead(id, request.getEmail(), request.getSource(), request.getScore(), request.getMessage());
        return ResponseEntity.ok(LeadDto.from(lead));
    }

    @DeleteMapping("/leads/{id}")
    @Operation(summary = "Delete lead")
    public ResponseEntity<Void> delete(@PathVariable UUID id, HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        leadService.getOwnedLead(id, user.getId());
        leadService.deleteLead(id);
        return ResponseEntity.noContent().build();
    }
}
