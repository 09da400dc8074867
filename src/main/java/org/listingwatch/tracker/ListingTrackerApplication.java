package org.listingwatch.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ListingTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ListingTrackerApplication.class, args);
    }
}
