package com.openwash.booking.api.dto;

import com.openwash.booking.domain.model.Booking;
import com.openwash.booking.domain.model.BookingKind;
import com.openwash.booking.domain.model.BookingServiceLine;
import com.openwash.booking.domain.model.BookingStatus;
import com.openwash.capacity.domain.model.ResourceKind;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record BookingResponse(
        UUID id,
        Long customerId,
        Long vehicleId,
        BookingKind kind,
        BookingStatus status,
        Instant scheduledAt,
        Instant plannedEnd,
        List<ServiceLine> services,
        BigDecimal totalPrice,
        Integer totalDurationMinutes,
        ResourceKind assignedResourceKind,
        Long assignedResourceId,
        Instant actualStart,
        Instant actualEnd,
        BigDecimal cancellationFee,
        BigDecimal overtimeCharge,
        BigDecimal finalAmount,
        Integer rating,
        String feedback,
        String notes,
        Instant createdAt
) {
    public record ServiceLine(Long serviceId, String name, BigDecimal price, Integer durationMinutes) {
        static ServiceLine from(BookingServiceLine line) {
            return new ServiceLine(line.getServiceId(), line.getName(), line.getPrice(), line.getDurationMinutes());
        }
    }

    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getCustomerId(),
                booking.getVehicleId(),
                booking.getKind(),
                booking.getStatus(),
                booking.getScheduledAt(),
                booking.plannedEnd(),
                booking.getServices().stream().map(ServiceLine::from).toList(),
                booking.getTotalPrice(),
                booking.getTotalDurationMinutes(),
                booking.getAssignedResourceKind(),
                booking.getAssignedResourceId(),
                booking.getActualStart(),
                booking.getActualEnd(),
                booking.getCancellationFee(),
                booking.getOvertimeCharge(),
                booking.finalAmount(),
                booking.getRating(),
                booking.getFeedback(),
                booking.getNotes(),
                booking.getCreatedAt()
        );
    }
}
