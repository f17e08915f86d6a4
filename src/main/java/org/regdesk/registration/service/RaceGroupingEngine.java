package org.regdesk.registration.service;

import org.regdesk.registration.exception.RegistrationInvariantException;
import org.regdesk.registration.model.ParticipantEntry;
import org.regdesk.registration.model.Race;
import org.regdesk.registration.model.RaceGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits the flat participant list into one group per race with a single
 * sort-merge pass.
 * <p>
 * Both lists must share the same sort prefix (race age, race name), so the
 * participants of a race form one contiguous run and the runs follow the race
 * order. The engine walks the races once and, for each race, consumes
 * participants from a shared cursor while their race name matches. Nothing is
 * ever revisited, so a participant that is out of place cannot be picked up by
 * a later race. Such leftovers are reported after the pass: in strict mode they
 * fail the request, otherwise they are dropped with a warning.
 * <p>
 * Participants carry only the race name, so race names must be unique within
 * the competition. A repeated name is rejected in strict mode and merges both
 * races' participants into the first of them otherwise.
 */
@Service
public class RaceGroupingEngine {

    private static final Logger log = LoggerFactory.getLogger(RaceGroupingEngine.class);

    private final boolean strict;

    public RaceGroupingEngine(@Value("${registration.grouping.strict:true}") boolean strict) {
        this.strict = strict;
    }

    /**
     * Group participants by race.
     *
     * @param races        races in report order
     * @param participants participants sorted like {@code races}
     * @return one group per race, in the order of {@code races}
     * @throws RegistrationInvariantException in strict mode, if two races share a
     *                                        name or some participant could not be
     *                                        assigned to a race
     */
    public List<RaceGroup> group(List<Race> races, List<ParticipantEntry> participants) {
        checkRaceNames(races);

        List<RaceGroup> groups = new ArrayList<>(races.size());
        int cursor = 0;

        for (Race race : races) {
            RaceGroup group = new RaceGroup(race);
            while (cursor < participants.size() && belongsTo(participants.get(cursor), race)) {
                group.getParticipants().add(participants.get(cursor));
                cursor++;
            }
            groups.add(group);
        }

        if (cursor < participants.size()) {
            handleLeftovers(participants, cursor);
        }

        return groups;
    }

    private void checkRaceNames(List<Race> races) {
        Set<String> names = new HashSet<>();
        for (Race race : races) {
            if (names.add(race.getName())) {
                continue;
            }
            String message = String.format(
                    "Race name '%s' is used by more than one race (race id %d); participants cannot be told apart",
                    race.getName(), race.getId());
            if (strict) {
                throw new RegistrationInvariantException(message);
            }
            log.warn("Ambiguous race name: {}", message);
        }
    }

    private static boolean belongsTo(ParticipantEntry participant, Race race) {
        return race.getName().equals(participant.getRaceName());
    }

    private void handleLeftovers(List<ParticipantEntry> participants, int firstUnassigned) {
        ParticipantEntry misplaced = participants.get(firstUnassigned);
        int dropped = participants.size() - firstUnassigned;
        String message = String.format(
                "%d of %d participants could not be assigned to a race; first unassigned: %s %s (race '%s'). "
                        + "Participant rows must be contiguous per race and follow the race order",
                dropped, participants.size(), misplaced.getFirstName(), misplaced.getLastName(),
                misplaced.getRaceName());

        if (strict) {
            throw new RegistrationInvariantException(message);
        }
        log.warn("Dropping participants: {}", message);
    }
}
