package org.regdesk.registration.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.ArrayList;
import java.util.List;

/**
 * Participant row of the report. The participant fields are written inline,
 * next to {@code specialCategoryFlags}.
 */
public class ParticipantWithSpecialCategories {

    @JsonUnwrapped
    private ParticipantEntry participant;
    // same length and order as ParticipantsPerRace#specialCategories
    private List<Boolean> specialCategoryFlags;

    public ParticipantWithSpecialCategories() {
        this.specialCategoryFlags = new ArrayList<>();
    }

    public ParticipantWithSpecialCategories(ParticipantEntry participant, List<Boolean> specialCategoryFlags) {
        this.participant = participant;
        this.specialCategoryFlags = specialCategoryFlags;
    }

    public ParticipantEntry getParticipant() {
        return participant;
    }

    public void setParticipant(ParticipantEntry participant) {
        this.participant = participant;
    }

    public List<Boolean> getSpecialCategoryFlags() {
        return specialCategoryFlags;
    }

    public void setSpecialCategoryFlags(List<Boolean> specialCategoryFlags) {
        this.specialCategoryFlags = specialCategoryFlags;
    }
}
