package com.scholary.consult.scribe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConsultScribeApplication {

  public static void main(String[] args) {
    SpringApplication.run(ConsultScribeApplication.class, args);
  }
}
