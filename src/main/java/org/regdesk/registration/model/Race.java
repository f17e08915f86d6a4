package org.regdesk.registration.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A race of a competition, as loaded for the registration list.
 * <p>
 * {@code fromAge} is the minimum age of the race's categories. It is only used
 * to order races and is not part of any report.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Race {
    private Long id;
    private Long competitionId;
    private String name;
    private int fromAge;
}
