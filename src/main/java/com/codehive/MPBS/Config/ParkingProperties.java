package com.codehive.MPBS.Config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Site-specific settings, bound from the {@code parking.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "parking")
public class ParkingProperties {

    private Facility facility = new Facility();
    private Bootstrap bootstrap = new Bootstrap();

    @Data
    public static class Facility {
        private String name = "VENGATESAN CAR PARKING";
        private String contact = "Tittagudi | Contact: 9791365506";
    }

    @Data
    public static class Bootstrap {
        private String adminUsername = "admin";

        // No default: without it the primary admin is created through /api/public/setup
        private String adminPassword;
    }
}
