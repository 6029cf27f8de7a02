package com.cgi.medscrub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MedScrubApplication {

	public static void main(String[] args) {
		SpringApplication.run(MedScrubApplication.class, args);
	}

}
