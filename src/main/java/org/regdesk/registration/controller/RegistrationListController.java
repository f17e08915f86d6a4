package org.regdesk.registration.controller;

import org.regdesk.registration.model.RegistrationReport;
import org.regdesk.registration.service.RegistrationReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the registration list of a competition.
 * Unknown competitions and load failures are mapped by
 * {@link org.regdesk.error.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/competitions")
public class RegistrationListController {

    private static final Logger log = LoggerFactory.getLogger(RegistrationListController.class);

    private final RegistrationReportService reportService;

    public RegistrationListController(RegistrationReportService reportService) {
        this.reportService = reportService;
    }

    /**
     * All participants of a competition, grouped by race.
     *
     * @param competitionId the competition id
     * @return RegistrationReport with one entry per race
     */
    @GetMapping("/{competitionId}/registration-list")
    public ResponseEntity<RegistrationReport> registrationList(@PathVariable long competitionId) {
        log.debug("Registration list requested for competition: {}", competitionId);
        return ResponseEntity.ok(reportService.buildReport(competitionId));
    }
}
