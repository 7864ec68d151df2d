package com.hieshield.frauddetector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.hieshield.frauddetector")
@EnableJpaRepositories(basePackages = "com.hieshield.frauddetector.infrastructure.jpa")
@EntityScan(basePackages = "com.hieshield.frauddetector.infrastructure.jpa")
public class HieFraudCoreApplication {
	public static void main(String[] args) {
		SpringApplication.run(HieFraudCoreApplication.class, args);
	}
}
