package org.mediacatalog.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Необязательные фильтры списка контента. Пустые значения не участвуют в запросе.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentFilter {
    private String type;
    private String rating;
    private Integer releaseYear;
    private String country;
    private String category;
    private String title;
    private String director;
    private String cast;
}
