package org.regdesk.registration.service;

import org.regdesk.registration.model.Race;
import org.regdesk.registration.model.SpecialCategory;
import org.regdesk.registration.model.SpecialCategoryMembership;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns special category memberships into per-participant flag vectors.
 * <p>
 * Both lookups are built once per request from the flat loader results, so
 * resolving a participant never touches the database.
 */
@Service
public class SpecialCategoryFlagResolver {

    /**
     * Index special categories by race id. Every race gets an entry, races
     * without special categories map to an empty list.
     *
     * @param races      races in report order
     * @param categories special categories of these races
     * @return categories per race id, in load order
     */
    public Map<Long, List<SpecialCategory>> indexByRace(List<Race> races, List<SpecialCategory> categories) {
        Map<Long, List<SpecialCategory>> byRace = new LinkedHashMap<>();
        for (Race race : races) {
            byRace.put(race.getId(), new ArrayList<>());
        }
        for (SpecialCategory category : categories) {
            List<SpecialCategory> raceCategories = byRace.get(category.getRaceId());
            if (raceCategories != null) {
                raceCategories.add(category);
            }
        }
        return byRace;
    }

    /**
     * Index memberships by participant id.
     *
     * @param memberships memberships in any order
     * @return special category ids per participant id
     */
    public Map<Long, Set<Long>> indexByParticipant(List<SpecialCategoryMembership> memberships) {
        Map<Long, Set<Long>> byParticipant = new HashMap<>();
        for (SpecialCategoryMembership membership : memberships) {
            byParticipant.computeIfAbsent(membership.getParticipantId(), id -> new HashSet<>())
                    .add(membership.getSpecialCategoryId());
        }
        return byParticipant;
    }

    /**
     * Resolve the flag vector of one participant.
     *
     * @param categories    the special categories of the participant's race
     * @param membershipIds ids of the special categories the participant belongs to
     * @return one flag per category, {@code true} where the participant is a member
     */
    public List<Boolean> resolve(List<SpecialCategory> categories, Set<Long> membershipIds) {
        List<Boolean> flags = new ArrayList<>(categories.size());
        for (SpecialCategory category : categories) {
            flags.add(membershipIds.contains(category.getId()));
        }
        return flags;
    }
}
