package com.prakash.stresscoach;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StressCoachApplication {

	public static void main(String[] args) {
		SpringApplication.run(StressCoachApplication.class, args);
	}

}
