package org.regdesk.integration;

import org.junit.jupiter.api.Test;
import org.regdesk.registration.model.RegistrationReport;
import org.regdesk.registration.service.RegistrationReportService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Starts the application against a database that already holds data and
 * checks that startup leaves it alone.
 */
@SpringBootTest
public class ExistingDataStartupTest {

    private static final String URL = "jdbc:h2:mem:regdesk-existing;DB_CLOSE_DELAY=-1";

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private RegistrationReportService reportService;

    @Autowired
    private Environment environment;

    @DynamicPropertySource
    static void existingDatabase(DynamicPropertyRegistry registry) {
        // Runs before the application context is refreshed
        JdbcTemplate setup = new JdbcTemplate(new DriverManagerDataSource(URL, "sa", ""));
        setup.execute("CREATE TABLE IF NOT EXISTS competitions ("
                + "id BIGINT PRIMARY KEY, name VARCHAR(255) NOT NULL, "
                + "event_date DATE NOT NULL, location VARCHAR(255))");
        setup.update("MERGE INTO competitions (id, name, event_date, location) "
                + "KEY (id) VALUES (500, 'Autumn Relay', DATE '2024-10-05', 'Elbwiesen')");

        registry.add("spring.datasource.url", () -> URL);
        // keep the test fixture out, only schema.sql runs
        registry.add("spring.sql.init.data-locations", () -> "optional:classpath:no-data.sql");
    }

    @Test
    void testExistingRowsSurviveStartup() {
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM competitions WHERE id = 500", Integer.class);

        assertThat(rows).isEqualTo(1);
    }

    @Test
    void testSchemaIsCompletedAroundExistingTables() {
        RegistrationReport report = reportService.buildReport(500);

        assertThat(report.getCompetitionInfo().getName()).isEqualTo("Autumn Relay");
        assertThat(report.getRaceGroups()).isEmpty();
    }

    @Test
    void testScriptInitIsNotForcedByDefault() {
        assertThat(environment.getProperty("spring.sql.init.mode")).isNull();
    }
}
