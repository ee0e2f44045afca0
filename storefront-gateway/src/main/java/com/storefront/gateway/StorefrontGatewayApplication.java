package com.storefront.gateway;

import com.storefront.common.config.JacksonConfig;
import com.storefront.common.web.ServiceInfoController;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

/** End-user facing entry point; forwards order requests to the order service */
@SpringBootApplication
@ConfigurationPropertiesScan
@Import({JacksonConfig.class, ServiceInfoController.class})
public class StorefrontGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(StorefrontGatewayApplication.class, args);
  }
}
