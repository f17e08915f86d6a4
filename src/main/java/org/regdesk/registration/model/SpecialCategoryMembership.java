package org.regdesk.registration.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpecialCategoryMembership {
    private Long participantId;
    private Long specialCategoryId;
}
