package com.frogolio.frogol.controller;

import com.frogolio.frogol.dto.*;
import com.frogolio.frogol.entity.Frogol;
import com.frogolio.frogol.entity.User;
import com.frogolio.frogol.security.CurrentUserResolver;
import com.frogolio.frogol.service.DisplayDates;
import com.frogolio.frogol.service.FrogolService;
import com.frogolio.frogol.service.LeadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API behind the owner's dashboard
 */
@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
@Tag(name = "Dashboard", description = "Frogol management and analytics for the signed-in user")
public class DashboardController {

    private final FrogolService frogolService;
    private final LeadService leadService;
    private final CurrentUserResolver currentUserResolver;

    // ==================== Frogols ====================

    @GetMapping("/frogols")
    @Operation(summary = "List frogols", description = "Summaries of the caller's frogols with lead and click totals")
    public ResponseEntity<DashboardDto> list(HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        List<FrogolSummaryDto> frogols = frogolService.getUserFrogols(user.getId());

        return ResponseEntity.ok(DashboardDto.builder()
                .userEmail(user.getEmail())
                .frogols(frogols)
                .frogolsCount(frogols.size())
                .totalLeads(leadService.getUserTotalLeads(user.getId()))
                .totalClicks(frogolService.getUserTotalClicks(user.getId()))
                .build());
    }

    @PostMapping("/frogols")
    @Operation(summary = "Create frogol", description = "Create a frogol; the slug is normalized and must be free")
    public ResponseEntity<FrogolDto> create(@Valid @RequestBody CreateFrogolRequest request, HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        Frogol frogol = frogolService.createFrogol(user.getId(), request.getSlug(), request.getDisplayName());
        return ResponseEntity.status(HttpStatus.CREATED).body(FrogolDto.from(frogol));
    }

    @GetMapping("/frogols/{id}")
    @Operation(summary = "Frogol detail", description = "All links with click counts, leads and click stats")
    public ResponseEntity<FrogolDetailDto> detail(@PathVariable UUID id, HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        Frogol frogol = frogolService.getOwnedFrogol(id, user.getId());

        return ResponseEntity.ok(FrogolDetailDto.builder()
                .frogol(FrogolDto.from(frogol))
                .formattedDate(DisplayDates.format(frogol.getCreatedAt()))
                .links(frogolService.getLinksWithClicks(id))
                .leads(leadService.getFrogolLeads(id))
                .clickStats(frogolService.getClickStats(id))
                .build());
    }

    @PutMapping("/frogols/{id}")
    @Operation(summary = "Update frogol", description = "Edit display name, theme, avatar URL and bio")
    public ResponseEntity<FrogolDto> update(@PathVariable UUID id,
                                            @Valid @RequestBody UpdateFrogolRequest request,
                                            HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        frogolService.getOwnedFrogol(id, user.getId());
        Frogol frogol = frogolService.updateFrogol(id, request.getDisplayName(), request.getTheme(),
                request.getAvatarUrl(), request.getBio());
        return ResponseEntity.ok(FrogolDto.from(frogol));
    }

    @DeleteMapping("/frogols/{id}")
    @Operation(summary = "Delete frogol", description = "Delete a frogol with its links, clicks, leads and images")
    public ResponseEntity<Void> delete(@PathVariable UUID id, HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        frogolService.getOwnedFrogol(id, user.getId());
        frogolService.deleteFrogol(id);
        return ResponseEntity.noContent().build();
    }

    // ==================== Analytics ====================

    @GetMapping("/analytics")
    @Operation(summary = "User analytics", description = "Totals across the caller's frogols and the top five by clicks")
    public ResponseEntity<UserAnalyticsDto> analytics(HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        return ResponseEntity.ok(frogolService.getUserAnalytics(user.getId()));
    }
}
