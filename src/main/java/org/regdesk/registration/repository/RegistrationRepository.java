package org.regdesk.registration.repository;

import org.regdesk.competition.model.Competition;
import org.regdesk.registration.model.ParticipantEntry;
import org.regdesk.registration.model.Race;
import org.regdesk.registration.model.SpecialCategory;
import org.regdesk.registration.model.SpecialCategoryMembership;

import java.util.List;
import java.util.Optional;

/**
 * Read access to everything the registration list needs.
 * Every method issues at most one query, so building a report costs a fixed
 * number of round trips no matter how many races or participants exist.
 * <p>
 * Data access failures surface as Spring's unchecked
 * {@link org.springframework.dao.DataAccessException} and are not retried.
 */
public interface RegistrationRepository {

    /**
     * Load a single competition.
     *
     * @param competitionId the competition id
     * @return the competition, or empty if no competition has this id
     */
    Optional<Competition> loadCompetition(long competitionId);

    /**
     * Load the races of a competition, ordered by the minimum age of their
     * categories and then by name.
     *
     * @param competitionId the competition id
     * @return races in report order
     */
    List<Race> loadRaces(long competitionId);

    /**
     * Load the special categories of the given races. Categories of one race
     * form a contiguous run and the runs follow the order of {@code races}.
     *
     * @param races races as returned by {@link #loadRaces(long)}
     * @return special categories, grouped by race
     */
    List<SpecialCategory> loadSpecialCategories(List<Race> races);

    /**
     * Load all participants of a competition, ordered by the minimum age of
     * their race, race name, birth year (youngest first), first name and last
     * name. All participants of one race are therefore contiguous and appear in
     * the same relative order as the races of {@link #loadRaces(long)}.
     *
     * @param competitionId the competition id
     * @return participants in report order
     */
    List<ParticipantEntry> loadParticipants(long competitionId);

    /**
     * Load the special category memberships of the participants of a
     * competition. No query is issued when {@code participants} is empty.
     *
     * @param competitionId the competition id
     * @param participants  participants as returned by {@link #loadParticipants(long)}
     * @return memberships in no particular order
     */
    List<SpecialCategoryMembership> loadMemberships(long competitionId, List<ParticipantEntry> participants);
}
