package com.nexus.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NexusApplication {
	public static void main(String[] args) {
		SpringApplication.run(NexusApplication.class, args);
	}
}
