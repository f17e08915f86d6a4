package org.regdesk.competition.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Entity
@Table(name = "competitions")
@NoArgsConstructor
@AllArgsConstructor
public class Competition {
    @Id
    private Long id;

    private String name;

    @Column(name = "event_date")
    private LocalDate eventDate;

    private String location; // free text, e.g. "Stadtpark, Dresden"
}
