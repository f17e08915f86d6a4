package org.regdesk.registration.exception;

public class CompetitionNotFoundException extends RuntimeException {
    private final long competitionId;

    public CompetitionNotFoundException(long competitionId) {
        super(String.format("No competition for id %d found", competitionId));
        this.competitionId = competitionId;
    }

    public long getCompetitionId() {
        return competitionId;
    }
}
