package com.gatekeeper.authgovernor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.gatekeeper.authgovernor")
@EnableJpaRepositories(basePackages = "com.gatekeeper.authgovernor.infrastructure.jpa")
@EntityScan(basePackages = "com.gatekeeper.authgovernor.infrastructure.jpa")
public class AuthGovernorApplication {
	public static void main(String[] args) {
		SpringApplication.run(AuthGovernorApplication.class, args);
	}
}
