package org.regdesk.registration.service;

import org.regdesk.competition.model.Competition;
import org.regdesk.registration.exception.RegistrationInvariantException;
import org.regdesk.registration.model.ParticipantEntry;
import org.regdesk.registration.model.ParticipantWithSpecialCategories;
import org.regdesk.registration.model.ParticipantsPerRace;
import org.regdesk.registration.model.RaceGroup;
import org.regdesk.registration.model.RegistrationReport;
import org.regdesk.registration.model.SpecialCategory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the registration report from grouped races. Keeps the order of the
 * groups and of the participants within each group.
 */
@Service
public class RegistrationReportAssembler {

    private final SpecialCategoryFlagResolver flagResolver;

    public RegistrationReportAssembler(SpecialCategoryFlagResolver flagResolver) {
        this.flagResolver = flagResolver;
    }

    public RegistrationReport assemble(Competition competition, List<RaceGroup> raceGroups,
            Map<Long, List<SpecialCategory>> categoriesByRace, Map<Long, Set<Long>> membershipsByParticipant) {
        Objects.requireNonNull(competition, "competition");

        List<ParticipantsPerRace> raceMap = new ArrayList<>(raceGroups.size());
        for (RaceGroup group : raceGroups) {
            List<SpecialCategory> categories = categoriesByRace.getOrDefault(group.getRace().getId(), List.of());

            List<ParticipantWithSpecialCategories> participants = new ArrayList<>(group.getParticipants().size());
            for (ParticipantEntry participant : group.getParticipants()) {
                Set<Long> membershipIds = membershipsByParticipant.getOrDefault(participant.getId(), Set.of());
                List<Boolean> flags = flagResolver.resolve(categories, membershipIds);
                if (flags.size() != categories.size()) {
                    throw new RegistrationInvariantException(String.format(
                            "Flag vector of %s %s has %d entries, race '%s' has %d special categories",
                            participant.getFirstName(), participant.getLastName(), flags.size(),
                            group.getRace().getName(), categories.size()));
                }
                participants.add(new ParticipantWithSpecialCategories(participant, flags));
            }

            raceMap.add(new ParticipantsPerRace(group.getRace().getName(), categories, participants));
        }

        return new RegistrationReport(competition, raceMap);
    }
}
