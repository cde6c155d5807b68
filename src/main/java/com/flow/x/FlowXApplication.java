package com.flow.x;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowXApplication {

	public static void main(String[] args) {
		SpringApplication.run(FlowXApplication.class, args);
	}

}
