package org.mediacatalog.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Снимок статистики каталога: общие счетчики, разбивка по рейтингам и топ категорий.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContentStats {
    private long totalContent;
    private long movies;
    private long tvShows;
    private List<RatingCount> byRating;
    private List<CategoryCount> byCategory;
}
