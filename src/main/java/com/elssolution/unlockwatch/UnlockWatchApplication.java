package com.elssolution.unlockwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
public class UnlockWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(UnlockWatchApplication.class, args);
    }

    /** Wall clock for sweeps, alerts and rendered timestamps. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

}
