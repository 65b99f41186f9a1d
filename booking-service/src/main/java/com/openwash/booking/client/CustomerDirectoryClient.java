package com.openwash.booking.client;

import com.openwash.booking.client.dto.CustomerResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

/**
 * Feign client for the customer directory. A 404 means the customer does not exist.
 */
@FeignClient(name = "customer-service", url = "${booking.clients.customer-service.url}", path = "/api/v1/customers")
public interface CustomerDirectoryClient {

    @GetMapping("/{customerId}")
    CustomerResponse getCustomer(@PathVariable("customerId") Long customerId);
}
