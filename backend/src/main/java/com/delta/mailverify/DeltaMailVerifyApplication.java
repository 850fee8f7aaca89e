package com.delta.mailverify;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeltaMailVerifyApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeltaMailVerifyApplication.class, args);
  }
}
