package org.mediacatalog.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Настройки приложения из блока {@code catalog.*}. Читаются один раз при старте.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    private final Security security = new Security();
    private final Importer importer = new Importer();
    private final Stats stats = new Stats();

    @Data
    public static class Security {
        @NotBlank
        private String jwtSecret;

        @Min(1)
        private long tokenTtlMinutes = 30;
    }

    @Data
    public static class Importer {
        @Min(1)
        private int batchSize = 100;

        private String defaultCsvPath = "/app/data/netflix.csv";
    }

    @Data
    public static class Stats {
        @Min(1)
        private int topCategories = 20;
    }
}
