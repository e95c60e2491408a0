package com.sandy.fleet.health;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class FleetHealthEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(FleetHealthEngineApplication.class, args);
	}

}
