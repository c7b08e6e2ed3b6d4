package com.scholary.captions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class CaptionsApplication {

  public static void main(String[] args) {
    SpringApplication.run(CaptionsApplication.class, args);
  }
}
