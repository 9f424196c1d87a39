package com.protocolguide.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.protocolguide")
@EnableJpaRepositories(basePackages = "com.protocolguide")
@EntityScan(basePackages = "com.protocolguide")
@ConfigurationPropertiesScan(basePackages = "com.protocolguide")
public class GuideApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(GuideApiApplication.class, args);
  }
}
