package com.storefront.inventoryservice.mapper;

import com.storefront.common.dto.InventoryItemResponse;
import com.storefront.inventoryservice.config.InventoryProperties;
import com.storefront.inventoryservice.dto.InventoryEntry;
import com.storefront.inventoryservice.model.Product;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ProductMapper {

    /**
     * Product -> single product snapshot.
     * A product is available while at least one unit is in stock.
     */
    @Mapping(source = "id", target = "productId")
    @Mapping(target = "available", expression = "java(product.getStock() > 0)")
    InventoryItemResponse toInventoryItemResponse(Product product);

    // Product -> listing entry (the id is the map key, so it is not repeated)
    InventoryEntry toInventoryEntry(Product product);

    Product toProduct(InventoryProperties.SeedProduct seed);
}
