package org.mediacatalog.repository;

import org.mediacatalog.dto.ContentFilter;
import org.mediacatalog.entity.CatalogRecord;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

public final class CatalogRecordSpecifications {
    private static final char ESCAPE = '\\';

    private CatalogRecordSpecifications() {
    }

    public static Specification<CatalogRecord> fromFilter(ContentFilter filter) {
        return Specification.where(equalTo("type", filter.getType()))
                .and(equalTo("rating", filter.getRating()))
                .and(releaseYear(filter.getReleaseYear()))
                .and(containsIgnoreCase("country", filter.getCountry()))
                .and(containsIgnoreCase("listedIn", filter.getCategory()))
                .and(containsIgnoreCase("title", filter.getTitle()))
                .and(containsIgnoreCase("director", filter.getDirector()))
                .and(containsIgnoreCase("cast", filter.getCast()));
    }

    /**
     * Поиск подстроки в названии, режиссере, актерах или описании.
     */
    public static Specification<CatalogRecord> matchesText(String query) {
        return Specification.anyOf(
                containsIgnoreCase("title", query),
                containsIgnoreCase("director", query),
                containsIgnoreCase("cast", query),
                containsIgnoreCase("description", query));
    }

    public static Specification<CatalogRecord> equalTo(String attribute, String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get(attribute), value);
    }

    public static Specification<CatalogRecord> releaseYear(Integer year) {
        // Год <= 0 в базе не хранится, такой фильтр не применяется
        if (year == null || year <= 0) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("releaseYear"), year);
    }

    public static Specification<CatalogRecord> containsIgnoreCase(String attribute, String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        String pattern = "%" + escapeLike(value.toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.like(cb.lower(root.<String>get(attribute)), pattern, ESCAPE);
    }

    // % и _ во вводе пользователя ищутся буквально
    static String escapeLike(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char ch : value.toCharArray()) {
            if (ch == '%' || ch == '_' || ch == ESCAPE) {
                escaped.append(ESCAPE);
            }
            escaped.append(ch);
        }
        return escaped.toString();
    }
}
