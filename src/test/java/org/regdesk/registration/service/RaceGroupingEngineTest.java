package org.regdesk.registration.service;

import org.junit.jupiter.api.Test;
import org.regdesk.registration.exception.RegistrationInvariantException;
import org.regdesk.registration.model.ParticipantEntry;
import org.regdesk.registration.model.Race;
import org.regdesk.registration.model.RaceGroup;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.regdesk.registration.RegistrationFixtures.participant;
import static org.regdesk.registration.RegistrationFixtures.race;

class RaceGroupingEngineTest {

    private final RaceGroupingEngine strictEngine = new RaceGroupingEngine(true);
    private final RaceGroupingEngine lenientEngine = new RaceGroupingEngine(false);

    @Test
    void testGroupsContiguousRunsInRaceOrder() {
        // Arrange
        List<Race> races = List.of(race(1, "5km", 10), race(2, "10km", 18));
        List<ParticipantEntry> participants = List.of(
                participant(1, "Anna", 2014, "5km"),
                participant(2, "Ben", 2012, "5km"),
                participant(3, "Carla", 1980, "5km"),
                participant(4, "David", 1995, "10km"),
                participant(5, "Eva", 1990, "10km"));

        // Act
        List<RaceGroup> groups = strictEngine.group(races, participants);

        // Assert
        assertEquals(2, groups.size());
        assertEquals("5km", groups.get(0).getRace().getName());
        assertEquals("10km", groups.get(1).getRace().getName());
        assertThat(groups.get(0).getParticipants()).extracting(ParticipantEntry::getFirstName)
                .containsExactly("Anna", "Ben", "Carla");
        assertThat(groups.get(1).getParticipants()).extracting(ParticipantEntry::getFirstName)
                .containsExactly("David", "Eva");
        assertEquals(participants.size(),
                groups.stream().mapToInt(group -> group.getParticipants().size()).sum());
    }

    @Test
    void testRaceWithoutParticipantsYieldsEmptyGroup() {
        List<Race> races = List.of(race(1, "2km", 6), race(2, "5km", 10), race(3, "10km", 18));
        List<ParticipantEntry> participants = List.of(
                participant(1, "Anna", 2014, "5km"),
                participant(2, "Eva", 1990, "10km"));

        List<RaceGroup> groups = strictEngine.group(races, participants);

        assertEquals(3, groups.size());
        assertTrue(groups.get(0).getParticipants().isEmpty());
        assertEquals(1, groups.get(1).getParticipants().size());
        assertEquals(1, groups.get(2).getParticipants().size());
    }

    @Test
    void testNoRacesAndNoParticipants() {
        List<RaceGroup> groups = strictEngine.group(List.of(), List.of());

        assertTrue(groups.isEmpty());
    }

    @Test
    void testTieOnFromAgeKeepsAttributionByName() {
        // Both races start at age 10, name breaks the tie
        List<Race> races = List.of(race(4, "5km", 10), race(3, "5mi", 10));
        List<ParticipantEntry> participants = List.of(
                participant(7, "Hugo", 2011, "5km"),
                participant(8, "Ida", 2011, "5mi"),
                participant(6, "Gina", 2010, "5mi"));

        List<RaceGroup> groups = strictEngine.group(races, participants);

        assertThat(groups.get(0).getParticipants()).extracting(ParticipantEntry::getFirstName)
                .containsExactly("Hugo");
        assertThat(groups.get(1).getParticipants()).extracting(ParticipantEntry::getFirstName)
                .containsExactly("Ida", "Gina");
    }

    @Test
    void testInterleavedParticipantsFailInStrictMode() {
        List<Race> races = List.of(race(4, "5km", 10), race(3, "5mi", 10));
        List<ParticipantEntry> participants = List.of(
                participant(7, "Hugo", 2011, "5km"),
                participant(8, "Ida", 2011, "5mi"),
                participant(9, "Jan", 2010, "5km"),
                participant(6, "Gina", 2010, "5mi"));

        assertThatThrownBy(() -> strictEngine.group(races, participants))
                .isInstanceOf(RegistrationInvariantException.class)
                .hasMessageContaining("2 of 4 participants")
                .hasMessageContaining("Jan");
    }

    @Test
    void testInterleavedParticipantsAreDroppedInLenientMode() {
        List<Race> races = List.of(race(4, "5km", 10), race(3, "5mi", 10));
        List<ParticipantEntry> participants = List.of(
                participant(7, "Hugo", 2011, "5km"),
                participant(8, "Ida", 2011, "5mi"),
                participant(9, "Jan", 2010, "5km"),
                participant(6, "Gina", 2010, "5mi"));

        List<RaceGroup> groups = lenientEngine.group(races, participants);

        assertThat(groups.get(0).getParticipants()).extracting(ParticipantEntry::getFirstName)
                .containsExactly("Hugo");
        assertThat(groups.get(1).getParticipants()).extracting(ParticipantEntry::getFirstName)
                .containsExactly("Ida");
    }

    @Test
    void testParticipantsWithoutAnyRaceFailInStrictMode() {
        List<ParticipantEntry> participants = List.of(participant(1, "Anna", 2014, "5km"));

        assertThatThrownBy(() -> strictEngine.group(List.of(), participants))
                .isInstanceOf(RegistrationInvariantException.class);
    }

    @Test
    void testParticipantsOfUnknownRaceAtTheEndFailInStrictMode() {
        List<Race> races = List.of(race(1, "5km", 10));
        List<ParticipantEntry> participants = List.of(
                participant(1, "Anna", 2014, "5km"),
                participant(2, "Ben", 2012, "Half marathon"));

        assertThatThrownBy(() -> strictEngine.group(races, participants))
                .isInstanceOf(RegistrationInvariantException.class)
                .hasMessageContaining("Half marathon");
    }

    @Test
    void testDuplicateRaceNameFailsInStrictMode() {
        List<Race> races = List.of(race(1, "5km", 10), race(2, "5km", 18));
        List<ParticipantEntry> participants = List.of(
                participant(1, "Kid", 2014, "5km"),
                participant(2, "Adult", 1990, "5km"));

        assertThatThrownBy(() -> strictEngine.group(races, participants))
                .isInstanceOf(RegistrationInvariantException.class)
                .hasMessageContaining("'5km'")
                .hasMessageContaining("race id 2");
    }

    @Test
    void testDuplicateRaceNameIsGroupedIntoFirstRaceInLenientMode() {
        List<Race> races = List.of(race(1, "5km", 10), race(2, "5km", 18));
        List<ParticipantEntry> participants = List.of(
                participant(1, "Kid", 2014, "5km"),
                participant(2, "Adult", 1990, "5km"));

        List<RaceGroup> groups = lenientEngine.group(races, participants);

        assertEquals(2, groups.size());
        assertThat(groups.get(0).getParticipants()).extracting(ParticipantEntry::getFirstName)
                .containsExactly("Kid", "Adult");
        assertTrue(groups.get(1).getParticipants().isEmpty());
    }
}
