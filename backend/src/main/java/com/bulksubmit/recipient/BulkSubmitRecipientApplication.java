package com.bulksubmit.recipient;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BulkSubmitRecipientApplication {

  public static void main(String[] args) {
    SpringApplication.run(BulkSubmitRecipientApplication.class, args);
  }
}
