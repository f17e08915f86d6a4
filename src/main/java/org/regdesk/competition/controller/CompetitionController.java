package org.regdesk.competition.controller;

import org.regdesk.competition.model.Competition;
import org.regdesk.competition.repository.CompetitionRepository;
import org.springframework.data.domain.Sort;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/competitions")
public class CompetitionController {

    private final CompetitionRepository competitionRepository;

    public CompetitionController(CompetitionRepository competitionRepository) {
        this.competitionRepository = competitionRepository;
    }

    @GetMapping
    public List<Competition> listCompetitions() {
        return competitionRepository.findAll(Sort.by("eventDate", "name"));
    }
}
