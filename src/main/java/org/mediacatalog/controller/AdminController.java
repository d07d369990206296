package org.mediacatalog.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediacatalog.config.CatalogProperties;
import org.mediacatalog.dto.ContentStats;
import org.mediacatalog.dto.FilterValues;
import org.mediacatalog.dto.ImportResult;
import org.mediacatalog.service.CatalogImportService;
import org.mediacatalog.service.CatalogStatisticsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Служебные endpoint'ы: информация о сервисе, health-check, загрузка данных и публичная статистика.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class AdminController {
    private final CatalogImportService catalogImportService;
    private final CatalogStatisticsService catalogStatisticsService;
    private final CatalogProperties properties;

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("list", "GET /content/");
        content.put("get_by_id", "GET /content/{id}");
        content.put("search", "GET /content/search/query");
        content.put("by_rating", "GET /content/by-rating/{rating}");
        content.put("by_category", "GET /content/by-category/{category}");
        content.put("filters", Map.of(
                "ratings", "GET /content/filters/ratings",
                "categories", "GET /content/filters/categories",
                "countries", "GET /content/filters/countries"));
        content.put("stats", "GET /content/stats/overview");

        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("auth", Map.of(
                "register", "POST /auth/register",
                "login", "POST /auth/login",
                "me", "GET /auth/me"));
        endpoints.put("content", content);
        endpoints.put("admin", Map.of(
                "load_data", "POST /load-data",
                "stats", "GET /stats",
                "filters", "GET /filters"));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Media Catalog REST API");
        response.put("version", "1.0.0");
        response.put("endpoints", endpoints);
        return response;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }

    @PostMapping("/load-data")
    public ImportResult loadData(@RequestParam(name = "csv_path", required = false) String csvPath) {
        String path = csvPath == null || csvPath.isBlank() ? properties.getImporter().getDefaultCsvPath() : csvPath;
        log.info("Запущена загрузка данных из {}", path);
        return catalogImportService.importCsv(path);
    }

    @GetMapping("/stats")
    public ContentStats stats() {
        return catalogStatisticsService.getOverview();
    }

    @GetMapping("/filters")
    public FilterValues filters() {
        return catalogStatisticsService.getFilterValues();
    }
}
