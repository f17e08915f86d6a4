package org.regdesk.registration.service;

import org.regdesk.competition.model.Competition;
import org.regdesk.registration.exception.CompetitionNotFoundException;
import org.regdesk.registration.model.ParticipantEntry;
import org.regdesk.registration.model.Race;
import org.regdesk.registration.model.RaceGroup;
import org.regdesk.registration.model.RegistrationReport;
import org.regdesk.registration.model.SpecialCategory;
import org.regdesk.registration.model.SpecialCategoryMembership;
import org.regdesk.registration.repository.RegistrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Produces the registration list of a competition: participants grouped by
 * race, each with a flag per special category of that race.
 * <p>
 * A report is built from five flat queries (competition, races, special
 * categories, participants, memberships) and then merged in memory. The query
 * count does not depend on the number of races or participants.
 */
@Service
public class RegistrationReportService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationReportService.class);

    private final RegistrationRepository repository;
    private final RaceGroupingEngine groupingEngine;
    private final SpecialCategoryFlagResolver flagResolver;
    private final RegistrationReportAssembler assembler;

    public RegistrationReportService(RegistrationRepository repository, RaceGroupingEngine groupingEngine,
            SpecialCategoryFlagResolver flagResolver, RegistrationReportAssembler assembler) {
        this.repository = repository;
        this.groupingEngine = groupingEngine;
        this.flagResolver = flagResolver;
        this.assembler = assembler;
    }

    /**
     * Build the registration report for a competition.
     *
     * @param competitionId the competition id
     * @return the report
     * @throws CompetitionNotFoundException if no competition has this id
     */
    @Transactional(readOnly = true)
    public RegistrationReport buildReport(long competitionId) {
        log.info("Building registration list for competition: {}", competitionId);

        Competition competition = repository.loadCompetition(competitionId)
                .orElseThrow(() -> new CompetitionNotFoundException(competitionId));

        List<Race> races = repository.loadRaces(competitionId);
        List<SpecialCategory> specialCategories = repository.loadSpecialCategories(races);
        List<ParticipantEntry> participants = repository.loadParticipants(competitionId);
        List<SpecialCategoryMembership> memberships = repository.loadMemberships(competitionId, participants);

        List<RaceGroup> raceGroups = groupingEngine.group(races, participants);
        Map<Long, List<SpecialCategory>> categoriesByRace = flagResolver.indexByRace(races, specialCategories);
        Map<Long, Set<Long>> membershipsByParticipant = flagResolver.indexByParticipant(memberships);

        RegistrationReport report = assembler.assemble(competition, raceGroups, categoriesByRace,
                membershipsByParticipant);

        log.info("Registration list for competition {}: {} participants in {} races, {} special categories",
                competitionId, participants.size(), races.size(), specialCategories.size());
        return report;
    }
}
