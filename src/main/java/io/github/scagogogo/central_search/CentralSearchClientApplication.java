package io.github.scagogogo.central_search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CentralSearchClientApplication {

  public static void main(String[] args) {
    SpringApplication.run(CentralSearchClientApplication.class, args);
  }
}
