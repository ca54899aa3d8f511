package com.rentnest.tm30;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * TM30 Service Application
 * Guest passport intake and TM30 immigration registration for rental bookings
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class Tm30ServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(Tm30ServiceApplication.class, args);
    }
}
