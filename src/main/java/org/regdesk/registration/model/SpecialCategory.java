package org.regdesk.registration.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpecialCategory {
    private Long id;
    @JsonIgnore
    private Long raceId;
    private String shortName; // column header, e.g. "LR"
    private String label;
}
