package com.reasonai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ReasonAi - staged reasoning pipeline service.
 */
@SpringBootApplication
public class ReasonAiApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReasonAiApplication.class, args);
	}

}
