package com.scholary.transcriber;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class TranscriberApplication {

  public static void main(String[] args) {
    SpringApplication.run(TranscriberApplication.class, args);
  }
}
