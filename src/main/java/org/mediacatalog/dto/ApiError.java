package org.mediacatalog.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiError {
    private String detail;
    private Map<String, String> errors; // Ошибки по полям запроса

    public ApiError(String detail) {
        this.detail = detail;
    }
}
