package com.openwash.booking.orchestration;

import com.openwash.booking.client.CustomerDirectoryClient;
import com.openwash.booking.client.ServiceCatalogClient;
import com.openwash.booking.client.VehicleRegistryClient;
import com.openwash.booking.client.dto.CatalogServiceResponse;
import com.openwash.booking.client.dto.CustomerResponse;
import com.openwash.booking.client.dto.VehicleResponse;
import com.openwash.booking.domain.model.BookingServiceLine;
import com.openwash.common.exception.BusinessException;
import com.openwash.common.exception.InvalidInputException;
import com.openwash.common.exception.ResourceNotFoundException;
import com.openwash.common.exception.ServiceUnavailableException;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only checks against the customer directory, vehicle registry and service catalog.
 *
 * Called before any write transaction opens. Each call goes through a Resilience4j retry and
 * circuit breaker; business answers (missing, inactive, wrong owner) are final and never retried,
 * transport failures and an open circuit become {@link ServiceUnavailableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExternalReferenceValidator {

    private final CustomerDirectoryClient customerDirectoryClient;
    private final VehicleRegistryClient vehicleRegistryClient;
    private final ServiceCatalogClient serviceCatalogClient;

    @Retry(name = "customer-service")
    @CircuitBreaker(name = "customer-service", fallbackMethod = "customerFallback")
    public void requireCustomer(Long customerId) {
        CustomerResponse customer;
        try {
            customer = customerDirectoryClient.getCustomer(customerId);
        } catch (FeignException.NotFound e) {
            throw new ResourceNotFoundException("Customer", customerId);
        }
        if (customer == null || !customer.active()) {
            throw new ResourceNotFoundException("Customer", customerId);
        }
    }

    /**
     * @return the vehicle, which is active and owned by the customer
     */
    @Retry(name = "vehicle-service")
    @CircuitBreaker(name = "vehicle-service", fallbackMethod = "vehicleFallback")
    public VehicleResponse requireVehicleOf(Long vehicleId, Long customerId) {
        VehicleResponse vehicle;
        try {
            vehicle = vehicleRegistryClient.getVehicle(vehicleId);
        } catch (FeignException.NotFound e) {
            throw new ResourceNotFoundException("Vehicle", vehicleId);
        }
        if (vehicle == null || !vehicle.active()) {
            throw new ResourceNotFoundException("Vehicle", vehicleId);
        }
        if (!customerId.equals(vehicle.customerId())) {
            throw new InvalidInputException(String.format(
                    "Vehicle %d does not belong to customer %d", vehicleId, customerId));
        }
        if (vehicle.sizeClass() == null) {
            throw new InvalidInputException("Vehicle " + vehicleId + " has no size class");
        }
        return vehicle;
    }

    /**
     * Prices the requested services at today's catalog values, in request order.
     */
    @Retry(name = "catalog-service")
    @CircuitBreaker(name = "catalog-service", fallbackMethod = "catalogFallback")
    public List<BookingServiceLine> resolveServices(List<Long> serviceIds) {
        if (serviceIds == null || serviceIds.isEmpty()) {
            throw new InvalidInputException("At least one service is required");
        }
        List<CatalogServiceResponse> found = serviceCatalogClient.getServices(serviceIds);
        Map<Long, CatalogServiceResponse> byId = (found == null ? List.<CatalogServiceResponse>of() : found).stream()
                .collect(Collectors.toMap(CatalogServiceResponse::id, Function.identity(), (a, b) -> a));

        List<BookingServiceLine> lines = new ArrayList<>(serviceIds.size());
        for (Long id : serviceIds) {
            CatalogServiceResponse service = byId.get(id);
            if (service == null || !service.active()) {
                throw new ResourceNotFoundException("Service", id);
            }
            lines.add(BookingServiceLine.of(service.id(), service.name(), service.price(), service.durationMinutes()));
        }
        return lines;
    }

    private void customerFallback(Long customerId, Throwable t) {
        throw unavailable("Customer directory", t);
    }

    private VehicleResponse vehicleFallback(Long vehicleId, Long customerId, Throwable t) {
        throw unavailable("Vehicle registry", t);
    }

    private List<BookingServiceLine> catalogFallback(List<Long> serviceIds, Throwable t) {
        throw unavailable("Service catalog", t);
    }

    private RuntimeException unavailable(String collaborator, Throwable t) {
        if (t instanceof BusinessException businessException) {
            return businessException;
        }
        log.warn("{} unavailable: {}", collaborator, t.toString());
        return new ServiceUnavailableException(collaborator + " is unavailable, try again later", t);
    }
}
