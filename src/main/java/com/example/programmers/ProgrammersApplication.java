package com.example.programmers;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProgrammersApplication {

	public static void main(String[] args) {
		SpringApplication.run(ProgrammersApplication.class, args);
	}

}
