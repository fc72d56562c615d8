package com.frogolio.frogol.service;

import com.frogolio.frogol.dto.*;
import com.frogolio.frogol.entity.*;
import com.frogolio.frogol.exception.ForbiddenException;
import com.frogolio.frogol.exception.FrogolioException;
import com.frogolio.frogol.exception.InvalidInputException;
import com.frogolio.frogol.exception.ResourceNotFoundException;
import com.frogolio.frogol.image.ImageStore;
import com.frogolio.frogol.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Frogols, their links and click analytics
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FrogolService {

    static final String DEFAULT_DISPLAY_NAME = "Frogol";
    static final int TOP_FROGOLS_LIMIT = 5;

    private final FrogolRepository frogolRepository;
    private final LinkRepository linkRepository;
    private final ClickRepository clickRepository;
    private final LeadRepository leadRepository;
    private final UserRepository userRepository;
    private final FrogolAvatarImageRepository avatarImageRepository;
    private final ImageStore imageStore;

    // ==================== Frogols ====================

    /**
     * Create a frogol for a user; the slug is normalized and must not be taken
     */
    @Transactional
    public Frogol createFrogol(UUID userId, String rawSlug, String displayName) {
        String slug = SlugNormalizer.normalize(rawSlug);

        // best-effort pre-check, the unique constraint on slug is the real guard
        if (frogolRepository.existsBySlug(slug)) {
            throw new InvalidInputException("Slug already exists");
        }

        User owner = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));

        Frogol frogol = Frogol.builder()
                .user(owner)
                .slug(slug)
                .displayName(displayName)
                .build();

        try {
            frogol = frogolRepository.saveAndFlush(frogol);
        } catch (DataIntegrityViolationException e) {
            log.warn("Slug {} taken concurrently", slug);
            throw new InvalidInputException("Slug already exists");
        }
        log.info("Created frogol {} with slug {}", frogol.getId(), slug);
        return frogol;
    }

    @Transactional(readOnly = true)
    public Frogol getBySlug(String slug) {
        return frogolRepository.findBySlug(slug)
                .orElseThrow(() -> new ResourceNotFoundException("Frogol not found: " + slug));
    }

    @Transactional(readOnly = true)
    public Frogol getById(UUID id) {
        return frogolRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Frogol not found: " + id));
    }

    /**
     * Load a frogol and make sure the caller owns it
     */
    @Transactional(readOnly = true)
    public Frogol getOwnedFrogol(UUID frogolId, UUID userId) {
        Frogol frogol = getById(frogolId);
        if (!frogol.isOwnedBy(userId)) {
            throw new ForbiddenException("Not the owner of this frogol");
        }
        return frogol;
    }

    @Transactional(readOnly = true)
    public Frogol getOwnedFrogolBySlug(String slug, UUID userId) {
        Frogol frogol = getBySlug(slug);
        if (!frogol.isOwnedBy(userId)) {
            throw new ForbiddenException("Not the owner of this frogol");
        }
        return frogol;
    }

    @Transactional(readOnly = true)
    public List<FrogolSummaryDto> getUserFrogols(UUID userId) {
        return frogolRepository.findSummariesByUserId(userId).stream()
                .map(this::toSummary)
                .collect(Collectors.toList());
    }

    /**
     * Update profile fields; a null avatarUrl or bio keeps the stored value
     */
    @Transactional
    public Frogol updateFrogol(UUID id, String displayName, String theme, String avatarUrl, String bio) {
        Frogol frogol = getById(id);

        frogol.setDisplayName(displayName);
        frogol.setTheme(theme);
        if (avatarUrl != null) {
            frogol.setAvatarUrl(avatarUrl);
        }
        if (bio != null) {
            frogol.setBio(bio);
        }
        return frogolRepository.save(frogol);
    }

    @Transactional
    public Frogol updateAvatarUrl(UUID id, String avatarUrl) {
        Frogol frogol = getById(id);
        frogol.setAvatarUrl(avatarUrl);
        return frogolRepository.save(frogol);
    }

    /**
     * Delete a frogol. Links, clicks, leads and image rows go with it through the store's
     * cascades; stored image files are removed best-effort afterwards.
     */
    @Transactional
    public void deleteFrogol(UUID id) {
        Frogol frogol = getById(id);

        List<String> imageFiles = avatarImageRepository.findByFrogolId(frogol.getId()).stream()
                .map(FrogolAvatarImage::getImageFilename)
                .collect(Collectors.toList());

        frogolRepository.deleteFrogolById(frogol.getId());
        log.info("Deleted frogol {} ({})", frogol.getId(), frogol.getSlug());

        if (!imageFiles.isEmpty()) {
            List<FrogolioException> failures = imageStore.deleteBatch(imageFiles);
            failures.forEach(e -> log.warn("Leftover image for deleted frogol {}: {}", id, e.getMessage()));
        }
    }

    // ==================== Links ====================

    /**
     * Append a link at the end of the frogol's ordering
     */
    @Transactional
    public Link addLink(UUID frogolId, String url, String label) {
        Frogol frogol = getById(frogolId);
        int nextOrder = linkRepository.nextSortOrder(frogolId);

        Link link = Link.builder()
                .frogol(frogol)
                .url(UrlNormalizer.normalize(url))
                .label(label)
                .sortOrder(nextOrder)
                .active(true)
                .kind(Link.DEFAULT_KIND)
                .build();

        link = linkRepository.save(link);
        log.debug("Added link {} to frogol {} at position {}", link.getId(), frogolId, nextOrder);
        return link;
    }

    @Transactional(readOnly = true)
    public List<Link> getLinks(UUID frogolId) {
        return linkRepository.findByFrogolIdAndActiveTrueOrderBySortOrderAscIdAsc(frogolId);
    }

    @Transactional(readOnly = true)
    public List<Link> getAllLinks(UUID frogolId) {
        return linkRepository.findByFrogolIdOrderBySortOrderAscIdAsc(frogolId);
    }

    /**
     * Every link of the frogol with its click count, for the owner's dashboard
     */
    @Transactional(readOnly = true)
    public List<LinkDto> getLinksWithClicks(UUID frogolId) {
        Map<UUID, Long> clicks = getClicksByLink(frogolId);
        return getAllLinks(frogolId).stream()
                .map(link -> {
                    LinkDto dto = LinkDto.from(link);
                    dto.setClicks(clicks.getOrDefault(link.getId(), 0L));
                    return dto;
                })
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public Link getLink(UUID linkId) {
        return linkRepository.findById(linkId)
                .orElseThrow(() -> new ResourceNotFoundException("Link not found: " + linkId));
    }

    @Transactional(readOnly = true)
    public Link getOwnedLink(UUID linkId, UUID userId) {
        Link link = getLink(linkId);
        if (!link.getFrogol().isOwnedBy(userId)) {
            throw new ForbiddenException("Not the owner of this link");
        }
        return link;
    }

    @Transactional
    public Link updateLink(UUID linkId, String url, String label) {
        Link link = getLink(linkId);
        link.setUrl(UrlNormalizer.normalize(url));
        link.setLabel(label);
        return linkRepository.save(link);
    }

    @Transactional
    public void setLinkActive(UUID linkId, boolean active) {
        Link link = getLink(linkId);
        link.setActive(active);
        linkRepository.save(link);
    }

    @Transactional
    public void deleteLink(UUID linkId) {
        Link link = getLink(linkId);
        linkRepository.delete(link);
        log.debug("Deleted link {}", linkId);
    }

    /**
     * Reorder the active links of the frogol owning the first requested id.
     * Requested ids come first, unmentioned links keep their relative order after them,
     * ids of other frogols are ignored. All positions are written in one transaction.
     */
    @Transactional
    public void updateLinkOrder(List<UUID> linkIds) {
        if (linkIds.isEmpty()) {
            return;
        }

        Link first = getLink(linkIds.get(0));
        UUID frogolId = first.getFrogol().getId();

        Map<UUID, Link> existing = new LinkedHashMap<>();
        for (Link link : linkRepository.findByFrogolIdAndActiveTrueOrderBySortOrderAscIdAsc(frogolId)) {
            existing.put(link.getId(), link);
        }

        List<UUID> finalOrder = LinkOrderResolver.resolve(linkIds, new ArrayList<>(existing.keySet()));
        for (int i = 0; i < finalOrder.size(); i++) {
            existing.get(finalOrder.get(i)).setSortOrder(i);
        }

        linkRepository.saveAll(existing.values());
        log.info("Reordered {} links of frogol {}", finalOrder.size(), frogolId);
    }

    // ==================== Clicks ====================

    /**
     * Record a visit of a link and return where to send the visitor
     */
    @Transactional
    public String trackClick(UUID linkId, String ipAddress, String userAgent) {
        Link link = getLink(linkId);

        Click click = Click.builder()
                .link(link)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .build();
        clickRepository.save(click);

        return link.getUrl();
    }

    @Transactional(readOnly = true)
    public ClickStatsDto getClickStats(UUID frogolId) {
        return ClickStatsDto.builder()
                .totalClicks(clickRepository.countByFrogolId(frogolId))
                .uniqueClicks(clickRepository.countDistinctIpByFrogolId(frogolId))
                .perLinkClicks(getClicksByLink(frogolId))
                .build();
    }

    @Transactional(readOnly = true)
    public Map<UUID, Long> getClicksByLink(UUID frogolId) {
        Map<UUID, Long> clicks = new LinkedHashMap<>();
        for (LinkClickCount row : clickRepository.countPerLinkByFrogolId(frogolId)) {
            clicks.put(row.getLinkId(), row.getClicks() == null ? 0L : row.getClicks());
        }
        return clicks;
    }

    @Transactional(readOnly = true)
    public long getUserTotalClicks(UUID userId) {
        return clickRepository.countByOwnerId(userId);
    }

    // ==================== Analytics ====================

    @Transactional(readOnly = true)
    public UserAnalyticsDto getUserAnalytics(UUID userId) {
        List<FrogolSummaryDto> top = getUserFrogols(userId).stream()
                .sorted(Comparator.comparingLong(FrogolSummaryDto::getTotalClicks).reversed()
                        .thenComparing(Comparator.comparingLong(FrogolSummaryDto::getTotalLeads).reversed()))
                .limit(TOP_FROGOLS_LIMIT)
                .collect(Collectors.toList());

        return UserAnalyticsDto.builder()
                .totalFrogols(frogolRepository.countByUserId(userId))
                .totalLinks(linkRepository.countByOwnerId(userId))
                .totalLeads(leadRepository.countByOwnerId(userId))
                .totalClicks(clickRepository.countByOwnerId(userId))
                .topPerformingFrogols(top)
                .build();
    }

    private FrogolSummaryDto toSummary(FrogolSummaryView view) {
        return FrogolSummaryDto.builder()
                .id(view.getId())
                .slug(view.getSlug())
                .displayName(view.getDisplayName() != null ? view.getDisplayName() : DEFAULT_DISPLAY_NAME)
                .totalLinks(nullToZero(view.getTotalLinks()))
                .totalLeads(nullToZero(view.getTotalLeads()))
                .totalClicks(nullToZero(view.getTotalClicks()))
                .createdAt(view.getCreatedAt())
                .formattedDate(DisplayDates.format(view.getCreatedAt()))
                .build();
    }

    private static long nullToZero(Long value) {
        return value == null ? 0L : value;
    }
}
