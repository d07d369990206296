package org.mediacatalog.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mediacatalog.CatalogFixtures;
import org.mediacatalog.dto.CategoryCount;
import org.mediacatalog.dto.ContentStats;
import org.mediacatalog.dto.RatingCount;
import org.mediacatalog.repository.CatalogRecordRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@SpringBootTest
class CatalogStatisticsServiceTest {

    @Autowired
    private CatalogStatisticsService statisticsService;

    @Autowired
    private CatalogImportService catalogImportService;

    @Autowired
    private CatalogRecordRepository catalogRecordRepository;

    @TempDir
    Path tempDir;

    @BeforeEach
    void cleanStore() {
        catalogRecordRepository.deleteAll();
    }

    @Test
    void emptyStoreGivesZeroCounts() {
        ContentStats stats = statisticsService.getOverview();

        assertThat(stats.getTotalContent()).isZero();
        assertThat(stats.getByRating()).isEmpty();
        assertThat(stats.getByCategory()).isEmpty();
        assertThat(statisticsService.getCountries()).isEmpty();
    }

    @Test
    void overviewCountsKindsRatingsAndCategories() throws Exception {
        catalogImportService.importCsv(CatalogFixtures.writeCatalog(tempDir, CatalogFixtures.THREE_ROWS).toString());

        ContentStats stats = statisticsService.getOverview();

        assertThat(stats.getTotalContent()).isEqualTo(3);
        assertThat(stats.getMovies()).isEqualTo(2);
        assertThat(stats.getTvShows()).isEqualTo(1);
        assertThat(stats.getByRating())
                .extracting(RatingCount::getRating, RatingCount::getCount)
                .containsExactly(tuple("PG-13", 1L), tuple("TV-14", 1L), tuple("TV-MA", 1L));
        assertThat(stats.getByCategory())
                .extracting(CategoryCount::getCategory, CategoryCount::getCount)
                .containsExactly(
                        tuple("Dramas", 2L),
                        tuple("Comedies", 1L),
                        tuple("Dark Comedies", 1L),
                        tuple("TV Horror", 1L),
                        tuple("Thrillers", 1L));
    }

    @Test
    void kindOutsideMovieAndShowCountsOnlyInTotal() throws Exception {
        catalogImportService.importCsv(CatalogFixtures.writeCatalog(tempDir, List.of(
                CatalogFixtures.row("s1", "Movie", "A", "PG", "Dramas"),
                CatalogFixtures.row("s2", "Short", "B", "PG", "Dramas"),
                CatalogFixtures.row("s3", "", "C", "R", "Dramas"))).toString());

        ContentStats stats = statisticsService.getOverview();

        assertThat(stats.getTotalContent()).isEqualTo(3);
        assertThat(stats.getMovies()).isEqualTo(1);
        assertThat(stats.getTvShows()).isZero();
        assertThat(stats.getByRating())
                .extracting(RatingCount::getRating, RatingCount::getCount)
                .containsExactly(tuple("PG", 2L), tuple("R", 1L));
    }

    @Test
    void filterValuesAreTokenizedAndSorted() throws Exception {
        catalogImportService.importCsv(CatalogFixtures.writeCatalog(tempDir, CatalogFixtures.THREE_ROWS).toString());

        assertThat(statisticsService.getRatings()).containsExactly("PG-13", "TV-14", "TV-MA");
        assertThat(statisticsService.getCountries()).containsExactly("India", "United Kingdom", "United States");
        assertThat(statisticsService.getCategories())
                .containsExactly("Comedies", "Dark Comedies", "Dramas", "TV Horror", "Thrillers");
        assertThat(statisticsService.getFilterValues().getCategories())
                .isEqualTo(statisticsService.getCategories());
    }

    @Test
    void uniqueTokensPreserveCase() {
        assertThat(CatalogStatisticsService.uniqueTokens(List.of("A, b ,C", "b,A")))
                .containsExactly("A", "C", "b");
    }

    @Test
    void topCategoriesIsCappedAndOrderedByCountThenName() {
        List<String> fields = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            fields.add(String.format("Genre %02d", i));
        }
        fields.add("Genre 24, Genre 10");
        fields.add("Genre 24");

        List<CategoryCount> top = CatalogStatisticsService.topCategories(fields, 20);

        assertThat(top).hasSize(20);
        assertThat(top.get(0)).isEqualTo(new CategoryCount("Genre 24", 3L));
        assertThat(top.get(1)).isEqualTo(new CategoryCount("Genre 10", 2L));
        assertThat(top.get(2)).isEqualTo(new CategoryCount("Genre 00", 1L));
        assertThat(top).extracting(CategoryCount::getCount).isSortedAccordingTo((a, b) -> Long.compare(b, a));
    }

    @Test
    void categoryCountsMatchTokensPerRecord() {
        List<String> fields = List.of("Dramas, Comedies", " Dramas ,", "Thrillers,,Dramas");

        long total = CatalogStatisticsService.topCategories(fields, 20).stream()
                .mapToLong(CategoryCount::getCount)
                .sum();

        assertThat(total).isEqualTo(5);
    }
}
