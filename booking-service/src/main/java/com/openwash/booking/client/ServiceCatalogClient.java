package com.openwash.booking.client;

import com.openwash.booking.client.dto.CatalogServiceResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

/**
 * Feign client for the wash service catalog.
 * Returns only the ids it knows; the caller checks for missing or inactive entries.
 */
@FeignClient(name = "catalog-service", url = "${booking.clients.catalog-service.url}", path = "/api/v1/services")
public interface ServiceCatalogClient {

    @GetMapping
    List<CatalogServiceResponse> getServices(@RequestParam("ids") List<Long> ids);
}
