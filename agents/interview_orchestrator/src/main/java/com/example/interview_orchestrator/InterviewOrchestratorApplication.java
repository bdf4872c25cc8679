package com.example.interview_orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InterviewOrchestratorApplication {
	public static void main(String[] args) {
		SpringApplication.run(InterviewOrchestratorApplication.class, args);
	}
}
