package org.regdesk.registration.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One registered participant, flattened with the label of its category, the
 * start time of its start and the name of its race.
 * <p>
 * Participants are matched to races by {@code raceName}, there is no race id on
 * this row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantEntry {
    @JsonIgnore
    private Long id;
    private String firstName;
    private String lastName;
    private String club; // optional
    private int birthYear;
    private LocalDateTime startTime;
    @JsonProperty("class")
    private String classLabel;
    @JsonIgnore
    private String raceName;
}
