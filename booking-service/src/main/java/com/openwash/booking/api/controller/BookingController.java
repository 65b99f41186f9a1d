package com.openwash.booking.api.controller;

import com.openwash.booking.api.dto.BookingPageResponse;
import com.openwash.booking.api.dto.BookingResponse;
import com.openwash.booking.api.dto.BookingSearchCriteria;
import com.openwash.booking.api.dto.CancelBookingRequest;
import com.openwash.booking.api.dto.CreateBookingRequest;
import com.openwash.booking.api.dto.RateBookingRequest;
import com.openwash.booking.api.dto.RescheduleBookingRequest;
import com.openwash.booking.api.dto.UpdateNotesRequest;
import com.openwash.booking.domain.model.Booking;
import com.openwash.booking.domain.model.BookingStatus;
import com.openwash.booking.orchestration.BookingOrchestrator;
import com.openwash.common.dto.BaseResponse;
import com.openwash.common.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.UUID;

/**
 * REST controller for booking operations. Every rule lives in the orchestrator and the aggregate;
 * this class only maps HTTP to calls.
 */
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<BaseResponse<BookingResponse>> createBooking(
            @Valid @RequestBody CreateBookingRequest request,
            @RequestHeader(name = Constants.REQUEST_TIMEOUT_HEADER, required = false) Long timeoutMs) {
        Booking booking = orchestrator.createBooking(request, timeoutMs);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Booking created successfully", BookingResponse.from(booking)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(@PathVariable UUID id) {
        return ok(orchestrator.getBooking(id));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<BookingPageResponse>> searchBookings(
            @RequestParam(required = false) Long customerId,
            @RequestParam(required = false) BookingStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        BookingSearchCriteria criteria = BookingSearchCriteria.builder()
                .customerId(customerId)
                .status(status)
                .from(from)
                .to(to)
                .build();
        Page<Booking> result = orchestrator.searchBookings(criteria, page, limit);
        return ResponseEntity.ok(BaseResponse.success(BookingPageResponse.from(result)));
    }

    @GetMapping("/customer/{customerId}")
    public ResponseEntity<BaseResponse<BookingPageResponse>> getBookingsByCustomer(
            @PathVariable Long customerId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        Page<Booking> result = orchestrator.listCustomerBookings(customerId, page, limit);
        return ResponseEntity.ok(BaseResponse.success(BookingPageResponse.from(result)));
    }

    @PutMapping("/{id}/notes")
    public ResponseEntity<BaseResponse<BookingResponse>> updateNotes(
            @PathVariable UUID id,
            @Valid @RequestBody UpdateNotesRequest request) {
        return ok(orchestrator.updateNotes(id, request.notes()));
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<BaseResponse<BookingResponse>> confirmBooking(@PathVariable UUID id) {
        return ok(orchestrator.confirmBooking(id));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<BaseResponse<BookingResponse>> startBooking(@PathVariable UUID id) {
        return ok(orchestrator.startBooking(id));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<BaseResponse<BookingResponse>> completeBooking(@PathVariable UUID id) {
        return ok(orchestrator.completeBooking(id));
    }

    @PostMapping("/{id}/no-show")
    public ResponseEntity<BaseResponse<BookingResponse>> markNoShow(@PathVariable UUID id) {
        return ok(orchestrator.markNoShow(id));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<BookingResponse>> cancelBooking(
            @PathVariable UUID id,
            @Valid @RequestBody CancelBookingRequest request) {
        return ok(orchestrator.cancelBooking(id, request.actor(), request.reason()));
    }

    @PostMapping("/{id}/reschedule")
    public ResponseEntity<BaseResponse<BookingResponse>> rescheduleBooking(
            @PathVariable UUID id,
            @Valid @RequestBody RescheduleBookingRequest request,
            @RequestHeader(name = Constants.REQUEST_TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return ok(orchestrator.rescheduleBooking(id, request.newScheduledAt(), timeoutMs));
    }

    @PostMapping("/{id}/services/{serviceId}")
    public ResponseEntity<BaseResponse<BookingResponse>> addService(
            @PathVariable UUID id,
            @PathVariable Long serviceId,
            @RequestHeader(name = Constants.REQUEST_TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return ok(orchestrator.addService(id, serviceId, timeoutMs));
    }

    @DeleteMapping("/{id}/services/{serviceId}")
    public ResponseEntity<BaseResponse<BookingResponse>> removeService(
            @PathVariable UUID id,
            @PathVariable Long serviceId,
            @RequestHeader(name = Constants.REQUEST_TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return ok(orchestrator.removeService(id, serviceId, timeoutMs));
    }

    @PostMapping("/{id}/rating")
    public ResponseEntity<BaseResponse<BookingResponse>> rateBooking(
            @PathVariable UUID id,
            @Valid @RequestBody RateBookingRequest request) {
        return ok(orchestrator.rateBooking(id, request.score(), request.feedback()));
    }

    private ResponseEntity<BaseResponse<BookingResponse>> ok(Booking booking) {
        return ResponseEntity.ok(BaseResponse.success(BookingResponse.from(booking)));
    }
}
