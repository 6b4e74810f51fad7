package com.techStack.courseHub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CourseHubApplication {

	public static void main(String[] args) {
		SpringApplication.run(CourseHubApplication.class, args);
	}
}
