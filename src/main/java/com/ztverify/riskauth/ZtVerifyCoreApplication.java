package com.ztverify.riskauth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.ztverify.riskauth")
@EnableJpaRepositories(basePackages = "com.ztverify.riskauth.infrastructure.jpa")
@EntityScan(basePackages = "com.ztverify.riskauth.infrastructure.jpa")
public class ZtVerifyCoreApplication {
	public static void main(String[] args) {
		SpringApplication.run(ZtVerifyCoreApplication.class, args);
	}
}
