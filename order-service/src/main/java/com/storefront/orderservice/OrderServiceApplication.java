package com.storefront.orderservice;

import com.storefront.common.config.JacksonConfig;
import com.storefront.common.web.ServiceInfoController;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

/** Order orchestrator: turns an order request into inventory reservations and a confirmed order */
@SpringBootApplication
@ConfigurationPropertiesScan
@Import({JacksonConfig.class, ServiceInfoController.class})
public class OrderServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(OrderServiceApplication.class, args);
  }
}
