package com.roommesh;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RoomMeshApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoomMeshApplication.class, args);
    }
}
