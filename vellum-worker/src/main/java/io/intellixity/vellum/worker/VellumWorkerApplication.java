package io.intellixity.vellum.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class VellumWorkerApplication {
  public static void main(String[] args) {
    SpringApplication.run(VellumWorkerApplication.class, args);
  }
}
