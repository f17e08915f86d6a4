package org.regdesk.registration.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A race together with the participants that were grouped into it.
 */
public class RaceGroup {

    private final Race race;
    private final List<ParticipantEntry> participants;

    public RaceGroup(Race race) {
        this(race, new ArrayList<>());
    }

    public RaceGroup(Race race, List<ParticipantEntry> participants) {
        this.race = race;
        this.participants = participants;
    }

    public Race getRace() {
        return race;
    }

    public List<ParticipantEntry> getParticipants() {
        return participants;
    }
}
