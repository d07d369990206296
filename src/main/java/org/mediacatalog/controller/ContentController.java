package org.mediacatalog.controller;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.mediacatalog.dto.ContentFilter;
import org.mediacatalog.dto.ContentStats;
import org.mediacatalog.entity.CatalogRecord;
import org.mediacatalog.service.CatalogQueryService;
import org.mediacatalog.service.CatalogStatisticsService;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Каталог для авторизованных пользователей. Токен проверяет
 * {@link org.mediacatalog.security.BearerTokenInterceptor}.
 */
@Validated
@RestController
@RequestMapping("/content")
@RequiredArgsConstructor
public class ContentController {
    private final CatalogQueryService catalogQueryService;
    private final CatalogStatisticsService catalogStatisticsService;

    @GetMapping({"", "/"})
    public List<CatalogRecord> getContent(
            @RequestParam(name = "type", required = false) String type,
            @RequestParam(name = "rating", required = false) String rating,
            @RequestParam(name = "release_year", required = false) Integer releaseYear,
            @RequestParam(name = "country", required = false) String country,
            @RequestParam(name = "category", required = false) String category,
            @RequestParam(name = "title", required = false) String title,
            @RequestParam(name = "director", required = false) String director,
            @RequestParam(name = "cast", required = false) String cast,
            @RequestParam(name = "limit", defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestParam(name = "offset", defaultValue = "0") @Min(0) int offset) {
        ContentFilter filter = ContentFilter.builder()
                .type(type)
                .rating(rating)
                .releaseYear(releaseYear)
                .country(country)
                .category(category)
                .title(title)
                .director(director)
                .cast(cast)
                .build();
        return catalogQueryService.findContent(filter, limit, offset);
    }

    @GetMapping("/{contentId}")
    public CatalogRecord getContentById(@PathVariable("contentId") Long contentId) {
        return catalogQueryService.getById(contentId);
    }

    @GetMapping("/search/query")
    public List<CatalogRecord> searchContent(
            @RequestParam(name = "q") @NotBlank String q,
            @RequestParam(name = "limit", defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestParam(name = "offset", defaultValue = "0") @Min(0) int offset) {
        return catalogQueryService.search(q, limit, offset);
    }

    @GetMapping("/filters/ratings")
    public List<String> getAllRatings() {
        return catalogStatisticsService.getRatings();
    }

    @GetMapping("/filters/categories")
    public List<String> getAllCategories() {
        return catalogStatisticsService.getCategories();
    }

    @GetMapping("/filters/countries")
    public List<String> getAllCountries() {
        return catalogStatisticsService.getCountries();
    }

    @GetMapping("/stats/overview")
    public ContentStats getStatistics() {
        return catalogStatisticsService.getOverview();
    }

    @GetMapping("/by-rating/{rating}")
    public List<CatalogRecord> getContentByRating(
            @PathVariable("rating") String rating,
            @RequestParam(name = "limit", defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestParam(name = "offset", defaultValue = "0") @Min(0) int offset) {
        return catalogQueryService.findByRating(rating, limit, offset);
    }

    @GetMapping("/by-category/{category}")
    public List<CatalogRecord> getContentByCategory(
            @PathVariable("category") String category,
            @RequestParam(name = "limit", defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestParam(name = "offset", defaultValue = "0") @Min(0) int offset) {
        return catalogQueryService.findByCategory(category, limit, offset);
    }
}
