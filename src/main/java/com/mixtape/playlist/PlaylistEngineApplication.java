package com.mixtape.playlist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PlaylistEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlaylistEngineApplication.class, args);
    }
}
