package org.caureq.hostwatch;

import org.caureq.hostwatch.config.AdminProps;
import org.caureq.hostwatch.config.AppProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AppProps.class, AdminProps.class})
public class HostWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(HostWatchApplication.class, args);
    }

}
