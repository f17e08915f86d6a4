package org.regdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegDeskApplication.class, args);
    }
}
