package com.furniture.workshop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkshopFlowApplication {

	public static void main(String[] args) {
		SpringApplication.run(WorkshopFlowApplication.class, args);
	}

}
