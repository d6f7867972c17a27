package com.scholary.talkingpet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TalkingPetApplication {

  public static void main(String[] args) {
    SpringApplication.run(TalkingPetApplication.class, args);
  }
}
