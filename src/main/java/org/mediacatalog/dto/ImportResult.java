package org.mediacatalog.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportResult {
    private String status;
    private int recordsProcessed;
    private int recordsInserted;
    private int recordsUpdated; // Всегда 0: обновление существующих записей не поддерживается
    private int recordsSkipped;
    private ContentStats statistics;
}
