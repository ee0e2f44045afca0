package com.storefront.inventoryservice.config;

import com.storefront.inventoryservice.mapper.ProductMapper;
import com.storefront.inventoryservice.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class InventoryDataLoader implements ApplicationRunner {

    private final InventoryProperties inventoryProperties;
    private final ProductRepository productRepository;
    private final ProductMapper productMapper;

    @Override
    public void run(ApplicationArguments args) {
        inventoryProperties.getProducts().forEach(seed -> {
            productRepository.save(productMapper.toProduct(seed));
            log.debug("Product seeded: id={}, name='{}', stock={}, price={}",
                    seed.getId(), seed.getName(), seed.getStock(), seed.getPrice());
        });
        log.info("Inventory seeded with {} products", productRepository.count());
    }
}
