package com.artistreach;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ArtistReachApplication {

  public static void main(String[] args) {
    SpringApplication.run(ArtistReachApplication.class, args);
  }
}
