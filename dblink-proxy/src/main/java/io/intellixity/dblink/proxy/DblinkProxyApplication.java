package io.intellixity.dblink.proxy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

// Connections are opened on request; Boot must not create its own client or pool.
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, MongoAutoConfiguration.class})
public class DblinkProxyApplication {
  public static void main(String[] args) {
    SpringApplication.run(DblinkProxyApplication.class, args);
  }
}
