package org.regdesk.registration.repository;

import org.regdesk.competition.model.Competition;
import org.regdesk.registration.model.ParticipantEntry;
import org.regdesk.registration.model.Race;
import org.regdesk.registration.model.SpecialCategory;
import org.regdesk.registration.model.SpecialCategoryMembership;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link RegistrationRepository} backed by plain SQL joins.
 * <p>
 * Schema chain: participants -> categories -> starts -> races -> competitions.
 * A race's age is the minimum {@code from_age} of the categories started in it;
 * both races and participants are sorted by that value so participant rows of
 * one race never interleave with another race, even if the race has categories
 * of very different ages.
 */
@Repository
public class JdbcRegistrationRepository implements RegistrationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRegistrationRepository.class);

    static final String COMPETITION_SQL = "SELECT id, name, event_date, location "
            + "FROM competitions "
            + "WHERE id = :competitionId";

    static final String RACES_SQL = "SELECT r.id, r.competition_id, r.name, MIN(c.from_age) AS from_age "
            + "FROM races r "
            + "JOIN starts s ON s.race_id = r.id "
            + "JOIN categories c ON c.start_id = s.id "
            + "WHERE r.competition_id = :competitionId "
            + "GROUP BY r.id, r.competition_id, r.name "
            + "ORDER BY MIN(c.from_age), r.name";

    static final String SPECIAL_CATEGORIES_SQL = "SELECT id, race_id, short_name, label "
            + "FROM special_categories "
            + "WHERE race_id IN (:raceIds) "
            + "ORDER BY race_id, id";

    static final String PARTICIPANTS_SQL = "SELECT p.id, p.first_name, p.last_name, p.club, p.birth_year, "
            + "       s.start_time, c.label AS class_label, r.name AS race_name "
            + "FROM participants p "
            + "JOIN categories c ON p.category_id = c.id "
            + "JOIN starts s ON c.start_id = s.id "
            + "JOIN races r ON s.race_id = r.id "
            + "JOIN (SELECT s2.race_id, MIN(c2.from_age) AS race_from_age "
            + "      FROM starts s2 "
            + "      JOIN categories c2 ON c2.start_id = s2.id "
            + "      GROUP BY s2.race_id) ra ON ra.race_id = r.id "
            + "WHERE r.competition_id = :competitionId "
            + "ORDER BY ra.race_from_age, r.name, p.birth_year DESC, p.first_name, p.last_name";

    static final String MEMBERSHIPS_SQL = "SELECT m.participant_id, m.special_category_id "
            + "FROM special_category_per_participant m "
            + "JOIN participants p ON p.id = m.participant_id "
            + "JOIN categories c ON p.category_id = c.id "
            + "JOIN starts s ON c.start_id = s.id "
            + "JOIN races r ON s.race_id = r.id "
            + "WHERE r.competition_id = :competitionId";

    private static final RowMapper<Competition> COMPETITION_MAPPER = (rs, rowNum) -> {
        Date eventDate = rs.getDate("event_date");
        return new Competition(
                rs.getLong("id"),
                rs.getString("name"),
                eventDate != null ? eventDate.toLocalDate() : null,
                rs.getString("location"));
    };

    private static final RowMapper<Race> RACE_MAPPER = (rs, rowNum) -> new Race(
            rs.getLong("id"),
            rs.getLong("competition_id"),
            rs.getString("name"),
            rs.getInt("from_age"));

    private static final RowMapper<SpecialCategory> SPECIAL_CATEGORY_MAPPER = (rs, rowNum) -> new SpecialCategory(
            rs.getLong("id"),
            rs.getLong("race_id"),
            rs.getString("short_name"),
            rs.getString("label"));

    private static final RowMapper<ParticipantEntry> PARTICIPANT_MAPPER = (rs, rowNum) -> {
        Timestamp startTime = rs.getTimestamp("start_time");
        return ParticipantEntry.builder()
                .id(rs.getLong("id"))
                .firstName(rs.getString("first_name"))
                .lastName(rs.getString("last_name"))
                .club(rs.getString("club"))
                .birthYear(rs.getInt("birth_year"))
                .startTime(startTime != null ? startTime.toLocalDateTime() : null)
                .classLabel(rs.getString("class_label"))
                .raceName(rs.getString("race_name"))
                .build();
    };

    private static final RowMapper<SpecialCategoryMembership> MEMBERSHIP_MAPPER =
            (rs, rowNum) -> new SpecialCategoryMembership(
                    rs.getLong("participant_id"),
                    rs.getLong("special_category_id"));

    private final NamedParameterJdbcOperations jdbc;

    public JdbcRegistrationRepository(NamedParameterJdbcOperations jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Competition> loadCompetition(long competitionId) {
        List<Competition> rows = jdbc.query(COMPETITION_SQL,
                new MapSqlParameterSource("competitionId", competitionId), COMPETITION_MAPPER);
        return rows.stream().findFirst();
    }

    @Override
    public List<Race> loadRaces(long competitionId) {
        List<Race> races = jdbc.query(RACES_SQL,
                new MapSqlParameterSource("competitionId", competitionId), RACE_MAPPER);
        log.debug("Loaded {} races for competition {}", races.size(), competitionId);
        return races;
    }

    @Override
    public List<SpecialCategory> loadSpecialCategories(List<Race> races) {
        if (races.isEmpty()) {
            return List.of();
        }

        List<Long> raceIds = races.stream().map(Race::getId).collect(Collectors.toList());
        List<SpecialCategory> categories = new ArrayList<>(jdbc.query(SPECIAL_CATEGORIES_SQL,
                new MapSqlParameterSource("raceIds", raceIds), SPECIAL_CATEGORY_MAPPER));

        // Runs come back in race id order; List.sort is stable, so this only
        // reorders whole runs to match the order of the races.
        Map<Long, Integer> racePosition = new HashMap<>();
        for (int i = 0; i < races.size(); i++) {
            racePosition.put(races.get(i).getId(), i);
        }
        categories.sort(Comparator.comparing((SpecialCategory category) -> racePosition.get(category.getRaceId())));

        log.debug("Loaded {} special categories for {} races", categories.size(), races.size());
        return categories;
    }

    @Override
    public List<ParticipantEntry> loadParticipants(long competitionId) {
        List<ParticipantEntry> participants = jdbc.query(PARTICIPANTS_SQL,
                new MapSqlParameterSource("competitionId", competitionId), PARTICIPANT_MAPPER);
        log.debug("Loaded {} participants for competition {}", participants.size(), competitionId);
        return participants;
    }

    @Override
    public List<SpecialCategoryMembership> loadMemberships(long competitionId, List<ParticipantEntry> participants) {
        if (participants.isEmpty()) {
            return List.of();
        }

        List<SpecialCategoryMembership> memberships = jdbc.query(MEMBERSHIPS_SQL,
                new MapSqlParameterSource("competitionId", competitionId), MEMBERSHIP_MAPPER);
        log.debug("Loaded {} special category memberships for {} participants of competition {}",
                memberships.size(), participants.size(), competitionId);
        return memberships;
    }
}
