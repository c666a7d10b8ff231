package com.emcit.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.emcit")
@EnableJpaRepositories(basePackages = "com.emcit")
@EntityScan(basePackages = "com.emcit")
@ConfigurationPropertiesScan(basePackages = "com.emcit")
public class EmcitApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(EmcitApiApplication.class, args);
  }
}
