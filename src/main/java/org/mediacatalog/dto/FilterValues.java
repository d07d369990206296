package org.mediacatalog.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FilterValues {
    private List<String> ratings;
    private List<String> countries;
    private List<String> categories;
}
