package io.github.riemr.slot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SlotPlannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SlotPlannerApplication.class, args);
	}

}
