package org.mediacatalog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediacatalog.config.CatalogProperties;
import org.mediacatalog.dto.CategoryCount;
import org.mediacatalog.dto.ContentStats;
import org.mediacatalog.dto.FilterValues;
import org.mediacatalog.dto.RatingCount;
import org.mediacatalog.repository.CatalogRecordRepository;
import org.mediacatalog.util.TokenSplitter;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Значения фильтров и статистика каталога.
 * <p>
 * Страны и категории хранятся одной строкой через запятую, отдельного индекса по ним нет,
 * поэтому каждый вызов читает соответствующую колонку целиком и разбирает ее в памяти.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CatalogStatisticsService {
    public static final String MOVIE = "Movie";
    public static final String TV_SHOW = "TV Show";

    private final CatalogRecordRepository catalogRecordRepository;
    private final CatalogProperties properties;

    public List<String> getRatings() {
        return catalogRecordRepository.findDistinctRatings().stream()
                .sorted()
                .toList();
    }

    public List<String> getCountries() {
        return uniqueTokens(catalogRecordRepository.findDistinctCountryFields());
    }

    public List<String> getCategories() {
        return uniqueTokens(catalogRecordRepository.findAllCategoryFields());
    }

    public FilterValues getFilterValues() {
        return new FilterValues(getRatings(), getCountries(), getCategories());
    }

    public ContentStats getOverview() {
        long total = catalogRecordRepository.count();
        long movies = catalogRecordRepository.countByType(MOVIE);
        long tvShows = catalogRecordRepository.countByType(TV_SHOW);

        List<RatingCount> byRating = catalogRecordRepository.countByRating();
        List<CategoryCount> byCategory = topCategories(catalogRecordRepository.findAllCategoryFields(),
                properties.getStats().getTopCategories());

        log.debug("Статистика: всего {}, фильмов {}, сериалов {}", total, movies, tvShows);
        return new ContentStats(total, movies, tvShows, byRating, byCategory);
    }

    static List<String> uniqueTokens(Collection<String> joinedValues) {
        TreeSet<String> tokens = new TreeSet<>();
        for (String joined : joinedValues) {
            tokens.addAll(TokenSplitter.split(joined));
        }
        return List.copyOf(tokens);
    }

    /**
     * Частота каждого жанра по всем записям, по убыванию; при равенстве по алфавиту.
     */
    static List<CategoryCount> topCategories(Collection<String> joinedValues, int limit) {
        Map<String, Long> counts = new HashMap<>();
        for (String joined : joinedValues) {
            for (String category : TokenSplitter.split(joined)) {
                counts.merge(category, 1L, Long::sum);
            }
        }

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .map(entry -> new CategoryCount(entry.getKey(), entry.getValue()))
                .toList();
    }
}
