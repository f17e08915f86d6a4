package org.regdesk.registration.model;

import org.regdesk.competition.model.Competition;

import java.util.ArrayList;
import java.util.List;

/**
 * Response model for the registration list of a competition.
 */
public class RegistrationReport {

    private Competition competitionInfo;
    private List<ParticipantsPerRace> raceGroups;

    public RegistrationReport() {
        this.raceGroups = new ArrayList<>();
    }

    public RegistrationReport(Competition competitionInfo, List<ParticipantsPerRace> raceGroups) {
        this.competitionInfo = competitionInfo;
        this.raceGroups = raceGroups != null ? raceGroups : new ArrayList<>();
    }

    public Competition getCompetitionInfo() {
        return competitionInfo;
    }

    public void setCompetitionInfo(Competition competitionInfo) {
        this.competitionInfo = competitionInfo;
    }

    public List<ParticipantsPerRace> getRaceGroups() {
        return raceGroups;
    }

    public void setRaceGroups(List<ParticipantsPerRace> raceGroups) {
        this.raceGroups = raceGroups;
    }
}
