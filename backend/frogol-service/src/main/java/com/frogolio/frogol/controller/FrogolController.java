package com.frogolio.frogol.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.frogolio.frogol.dto.AddLinkRequest;
import com.frogolio.frogol.dto.FrogolPageDto;
import com.frogolio.frogol.dto.LinkDto;
import com.frogolio.frogol.dto.UpdateLinkRequest;
import com.frogolio.frogol.entity.Frogol;
import com.frogolio.frogol.entity.Link;
import com.frogolio.frogol.entity.User;
import com.frogolio.frogol.exception.InvalidInputException;
import com.frogolio.frogol.security.CurrentUserResolver;
import com.frogolio.frogol.service.FrogolService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST API for public frogol pages, links and click tracking
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Frogol", description = "Public pages, link management and click tracking APIs")
public class FrogolController {

    private static final String FORWARDED_FOR = "X-Forwarded-For";

    private final FrogolService frogolService;
    private final CurrentUserResolver currentUserResolver;

    // ==================== Public page ====================

    @GetMapping("/frogol/{slug}")
    @Operation(summary = "Get frogol page", description = "Profile and active links of a frogol, in display order")
    public ResponseEntity<FrogolPageDto> getPage(@PathVariable String slug) {
        Frogol frogol = frogolService.getBySlug(slug);
        List<LinkDto> links = frogolService.getLinks(frogol.getId()).stream()
                .map(LinkDto::from)
                .collect(Collectors.toList());

        return ResponseEntity.ok(FrogolPageDto.builder()
                .frogolId(frogol.getId())
                .slug(frogol.getSlug())
                .displayName(frogol.getDisplayName())
                .theme(frogol.getTheme())
                .avatarUrl(frogol.getAvatarUrl())
                .bio(frogol.getBio())
                .links(links)
                .build());
    }

    // ==================== Links ====================

    @PostMapping("/frogol/{slug}/links")
    @Operation(summary = "Add link", description = "Append a link to the end of a frogol's list")
    public ResponseEntity<LinkDto> addLink(@PathVariable String slug,
                                           @Valid @RequestBody AddLinkRequest request,
                                           HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        Frogol frogol = frogolService.getOwnedFrogolBySlug(slug, user.getId());
        Link link = frogolService.addLink(frogol.getId(), request.getUrl(), request.getLabel());
        return ResponseEntity.status(HttpStatus.CREATED).body(LinkDto.from(link));
    }

    @PutMapping(value = "/links/order", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Reorder links", description = "Accepts {\"id\": [...]}, {\"ids\": [...]} or a bare array of link ids")
    public ResponseEntity<Map<String, Object>> reorderLinks(@RequestBody JsonNode body, HttpServletRequest httpRequest) {
        return reorder(linkIdsFrom(body), httpRequest);
    }

    @PutMapping(value = "/links/order", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    @Operation(summary = "Reorder links (form)", description = "Accepts repeated id=... form fields")
    public ResponseEntity<Map<String, Object>> reorderLinksForm(@RequestParam(name = "id", required = false) List<String> ids,
                                                                HttpServletRequest httpRequest) {
        List<UUID> linkIds = new ArrayList<>();
        if (ids != null) {
            for (String id : ids) {
                linkIds.add(parseLinkId(id));
            }
        }
        return reorder(linkIds, httpRequest);
    }

    @GetMapping("/links/{id}")
    @Operation(summary = "Get link", description = "Get one of the caller's links")
    public ResponseEntity<LinkDto> getLink(@PathVariable UUID id, HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        return ResponseEntity.ok(LinkDto.from(frogolService.getOwnedLink(id, user.getId())));
    }

    @PutMapping("/links/{id}")
    @Operation(summary = "Update link", description = "Change url or label; isActive=false hides the link and returns no content")
    public ResponseEntity<LinkDto> updateLink(@PathVariable UUID id,
                                              @Valid @RequestBody UpdateLinkRequest request,
                                              HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        Link link = frogolService.getOwnedLink(id, user.getId());

        if (Boolean.FALSE.equals(request.getIsActive())) {
            frogolService.setLinkActive(id, false);
            return ResponseEntity.noContent().build();
        }

        String url = request.getUrl() != null ? request.getUrl() : link.getUrl();
        String label = request.getLabel() != null ? request.getLabel() : link.getLabel();
        Link updated = frogolService.updateLink(id, url, label);
        if (Boolean.TRUE.equals(request.getIsActive()) && !Boolean.TRUE.equals(updated.getActive())) {
            frogolService.setLinkActive(id, true);
            updated.setActive(true);
        }
        return ResponseEntity.ok(LinkDto.from(updated));
    }

    @DeleteMapping("/links/{id}")
    @Operation(summary = "Delete link", description = "Remove a link and its clicks")
    public ResponseEntity<Void> deleteLink(@PathVariable UUID id, HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        frogolService.getOwnedLink(id, user.getId());
        frogolService.deleteLink(id);
        return ResponseEntity.noContent().build();
    }

    // ==================== Clicks ====================

    @RequestMapping(value = "/links/{id}/click", method = {RequestMethod.GET, RequestMethod.POST})
    @Operation(summary = "Follow link", description = "Record a click and redirect to the link's URL")
    public ResponseEntity<Void> click(@PathVariable UUID id, HttpServletRequest httpRequest) {
        String url = frogolService.trackClick(id, clientIp(httpRequest), httpRequest.getHeader(HttpHeaders.USER_AGENT));
        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, url)
                .build();
    }

    private ResponseEntity<Map<String, Object>> reorder(List<UUID> linkIds, HttpServletRequest httpRequest) {
        User user = currentUserResolver.requireUser(httpRequest);
        if (!linkIds.isEmpty()) {
            // the first id decides which frogol is reordered
            frogolService.getOwnedLink(linkIds.get(0), user.getId());
        }
        frogolService.updateLinkOrder(linkIds);
        return ResponseEntity.ok(Map.of("success", true));
    }

    static List<UUID> linkIdsFrom(JsonNode body) {
        JsonNode ids = body;
        if (body != null && body.isObject()) {
            ids = body.has("id") ? body.get("id") : body.get("ids");
        }
        if (ids == null || ids.isNull()) {
            throw new InvalidInputException("Expected a list of link ids");
        }

        List<UUID> linkIds = new ArrayList<>();
        if (ids.isTextual()) {
            linkIds.add(parseLinkId(ids.asText()));
        } else if (ids.isArray()) {
            for (JsonNode id : ids) {
                if (!id.isTextual()) {
                    throw new InvalidInputException("Invalid link id: " + id);
                }
                linkIds.add(parseLinkId(id.asText()));
            }
        } else {
            throw new InvalidInputException("Expected a list of link ids");
        }
        return linkIds;
    }

    private static UUID parseLinkId(String raw) {
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Invalid link id: " + raw);
        }
    }

    private static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
