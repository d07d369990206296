package org.mediacatalog.repository;

import org.mediacatalog.dto.RatingCount;
import org.mediacatalog.entity.CatalogRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface CatalogRecordRepository extends JpaRepository<CatalogRecord, Long>,
        JpaSpecificationExecutor<CatalogRecord> {

    boolean existsByShowId(String showId); // Проверка по внешнему идентификатору

    long countByType(String type);

    @Query("""
            SELECT DISTINCT c.rating FROM CatalogRecord c
            WHERE c.rating IS NOT NULL AND c.rating <> ''
            """)
    List<String> findDistinctRatings();

    @Query("""
            SELECT new org.mediacatalog.dto.RatingCount(c.rating, COUNT(c))
            FROM CatalogRecord c
            WHERE c.rating IS NOT NULL AND c.rating <> ''
            GROUP BY c.rating
            ORDER BY COUNT(c) DESC, c.rating ASC
            """)
    List<RatingCount> countByRating();

    @Query("""
            SELECT DISTINCT c.country FROM CatalogRecord c
            WHERE c.country IS NOT NULL AND c.country <> ''
            """)
    List<String> findDistinctCountryFields();

    // Без DISTINCT: для статистики важна частота по каждой записи
    @Query("""
            SELECT c.listedIn FROM CatalogRecord c
            WHERE c.listedIn IS NOT NULL AND c.listedIn <> ''
            """)
    List<String> findAllCategoryFields();
}
