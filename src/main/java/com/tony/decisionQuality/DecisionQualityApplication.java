package com.tony.decisionQuality;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DecisionQualityApplication {

	public static void main(String[] args) {
		SpringApplication.run(DecisionQualityApplication.class, args);
	}

}
