package org.regdesk.registration.model;

import java.util.ArrayList;
import java.util.List;

/**
 * All participants of one race, ordered by age, with the special categories
 * that define the column order of their flags.
 */
public class ParticipantsPerRace {

    private String raceName;
    private List<SpecialCategory> specialCategories;
    private List<ParticipantWithSpecialCategories> participants;

    public ParticipantsPerRace() {
        this.specialCategories = new ArrayList<>();
        this.participants = new ArrayList<>();
    }

    public ParticipantsPerRace(String raceName, List<SpecialCategory> specialCategories,
            List<ParticipantWithSpecialCategories> participants) {
        this.raceName = raceName;
        this.specialCategories = specialCategories;
        this.participants = participants;
    }

    public String getRaceName() {
        return raceName;
    }

    public void setRaceName(String raceName) {
        this.raceName = raceName;
    }

    public List<SpecialCategory> getSpecialCategories() {
        return specialCategories;
    }

    public void setSpecialCategories(List<SpecialCategory> specialCategories) {
        this.specialCategories = specialCategories;
    }

    public List<ParticipantWithSpecialCategories> getParticipants() {
        return participants;
    }

    public void setParticipants(List<ParticipantWithSpecialCategories> participants) {
        this.participants = participants;
    }
}
