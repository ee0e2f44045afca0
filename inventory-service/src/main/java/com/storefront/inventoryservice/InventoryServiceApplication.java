package com.storefront.inventoryservice;

import com.storefront.common.config.JacksonConfig;
import com.storefront.common.web.ServiceInfoController;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

/** Inventory store: owns product stock and serves the read/reserve contract */
@SpringBootApplication
@ConfigurationPropertiesScan
@Import({JacksonConfig.class, ServiceInfoController.class})
public class InventoryServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(InventoryServiceApplication.class, args);
  }
}
