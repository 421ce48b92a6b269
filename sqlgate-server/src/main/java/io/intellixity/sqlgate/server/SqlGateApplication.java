package io.intellixity.sqlgate.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class SqlGateApplication {
  public static void main(String[] args) {
    SpringApplication.run(SqlGateApplication.class, args);
  }
}
