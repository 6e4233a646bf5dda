package io.b2mash.propertysync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PropertySyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(PropertySyncApplication.class, args);
  }
}
