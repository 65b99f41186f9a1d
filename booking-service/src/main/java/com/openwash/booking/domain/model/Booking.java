package com.openwash.booking.domain.model;

import com.openwash.booking.domain.policy.BookingFeePolicy;
import com.openwash.capacity.domain.model.GeoLocation;
import com.openwash.capacity.domain.model.ResourceKind;
import com.openwash.capacity.domain.model.ResourceRef;
import com.openwash.capacity.domain.model.VehicleSize;
import com.openwash.common.exception.InvalidInputException;
import com.openwash.common.exception.InvalidTransitionException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Wash booking aggregate.
 *
 * All state changes go through the transition methods below, which enforce the lifecycle:
 * PENDING -> CONFIRMED -> IN_PROGRESS -> COMPLETED, with CANCELLED reachable from PENDING and
 * CONFIRMED and NO_SHOW from CONFIRMED. COMPLETED, CANCELLED and NO_SHOW are terminal.
 * Rows are never deleted.
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_customer_id", columnList = "customer_id"),
        @Index(name = "idx_bookings_status_scheduled", columnList = "status,scheduled_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Booking {

    public static final int MIN_SERVICES = 1;
    public static final int MAX_SERVICES = 10;
    public static final int MIN_DURATION_MINUTES = 30;
    public static final int MAX_DURATION_MINUTES = 240;
    public static final BigDecimal MAX_TOTAL_PRICE = new BigDecimal("10000.00");
    public static final Duration MAX_ADVANCE = Duration.ofDays(90);
    public static final Duration MIN_RESCHEDULE_NOTICE = Duration.ofHours(2);
    public static final int MAX_FEEDBACK_LENGTH = 1000;
    public static final int MAX_NOTES_LENGTH = 500;

    private static final Set<BookingStatus> ACTIVE_BEFORE_START =
            EnumSet.of(BookingStatus.PENDING, BookingStatus.CONFIRMED);

    @Id
    private UUID id;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "vehicle_id", nullable = false)
    private Long vehicleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "vehicle_size", nullable = false, length = 20)
    private VehicleSize vehicleSize;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "booking_services", joinColumns = @JoinColumn(name = "booking_id"))
    @OrderColumn(name = "line_order")
    private List<BookingServiceLine> services = new ArrayList<>();

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "total_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalPrice;

    @Column(name = "total_duration_minutes", nullable = false)
    private int totalDurationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private BookingKind kind;

    @Column(name = "customer_latitude")
    private Double customerLatitude;

    @Column(name = "customer_longitude")
    private Double customerLongitude;

    @Enumerated(EnumType.STRING)
    @Column(name = "assigned_resource_kind", length = 20)
    private ResourceKind assignedResourceKind;

    @Column(name = "assigned_resource_id")
    private Long assignedResourceId;

    @Column(name = "actual_start")
    private Instant actualStart;

    @Column(name = "actual_end")
    private Instant actualEnd;

    @Column(name = "cancellation_fee", precision = 10, scale = 2)
    private BigDecimal cancellationFee;

    @Column(name = "overtime_charge", precision = 10, scale = 2)
    private BigDecimal overtimeCharge;

    @Column(name = "rating")
    private Integer rating;

    @Column(name = "feedback", length = MAX_FEEDBACK_LENGTH)
    private String feedback;

    @Column(name = "notes", length = MAX_NOTES_LENGTH)
    private String notes;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "cancelled_by", length = 100)
    private String cancelledBy;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    /**
     * New PENDING booking. No resource is assigned yet.
     *
     * @param location required for MOBILE bookings
     * @param now      reference time for the "in the future" and 90-day checks
     */
    public static Booking create(Long customerId, Long vehicleId, VehicleSize vehicleSize,
                                 List<BookingServiceLine> serviceLines, Instant scheduledAt,
                                 BookingKind kind, GeoLocation location, String notes, Instant now) {
        if (customerId == null || vehicleId == null) {
            throw new InvalidInputException("Customer and vehicle are required");
        }
        if (vehicleSize == null) {
            throw new InvalidInputException("Vehicle size is required");
        }
        if (kind == null) {
            throw new InvalidInputException("Booking kind is required");
        }
        if (kind == BookingKind.MOBILE && location == null) {
            throw new InvalidInputException("Mobile bookings require the customer location");
        }
        if (scheduledAt == null || !scheduledAt.isAfter(now)) {
            throw new InvalidInputException("Scheduled time must be in the future");
        }
        requireWithinBookingHorizon(scheduledAt, now);
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw new InvalidInputException("Notes must not exceed " + MAX_NOTES_LENGTH + " characters");
        }
        List<BookingServiceLine> lines = serviceLines == null ? List.of() : List.copyOf(serviceLines);
        validateServiceSet(lines);

        Booking booking = new Booking();
        booking.id = UUID.randomUUID();
        booking.customerId = customerId;
        booking.vehicleId = vehicleId;
        booking.vehicleSize = vehicleSize;
        booking.services = new ArrayList<>(lines);
        booking.scheduledAt = scheduledAt;
        booking.kind = kind;
        if (location != null) {
            booking.customerLatitude = location.latitude();
            booking.customerLongitude = location.longitude();
        }
        booking.notes = notes;
        booking.status = BookingStatus.PENDING;
        booking.createdAt = now;
        booking.updatedAt = now;
        booking.recalculateTotals();
        return booking;
    }

    public void confirm(Instant now) {
        requireStatus(BookingStatus.CONFIRMED, BookingStatus.PENDING);
        status = BookingStatus.CONFIRMED;
        updatedAt = now;
    }

    public void start(Instant now) {
        requireStatus(BookingStatus.IN_PROGRESS, BookingStatus.CONFIRMED);
        actualStart = now;
        status = BookingStatus.IN_PROGRESS;
        updatedAt = now;
    }

    public void complete(Instant now) {
        requireStatus(BookingStatus.COMPLETED, BookingStatus.IN_PROGRESS);
        if (now.isBefore(actualStart)) {
            throw new InvalidInputException("Actual end " + now + " is before actual start " + actualStart);
        }
        actualEnd = now;
        overtimeCharge = BookingFeePolicy.overtimeCharge(
                BookingFeePolicy.overtimeMinutes(totalDurationMinutes, actualStart, actualEnd));
        status = BookingStatus.COMPLETED;
        updatedAt = now;
    }

    /**
     * @param actor opaque identifier of whoever cancelled (customer, staff, system)
     */
    public void cancel(Instant now, String actor, String reason) {
        requireStatus(BookingStatus.CANCELLED, BookingStatus.PENDING, BookingStatus.CONFIRMED);
        if (reason != null && reason.length() > 500) {
            throw new InvalidInputException("Cancellation reason must not exceed 500 characters");
        }
        cancellationFee = BookingFeePolicy.cancellationFee(totalPrice, Duration.between(now, scheduledAt));
        cancelledAt = now;
        cancelledBy = actor;
        cancellationReason = reason;
        status = BookingStatus.CANCELLED;
        updatedAt = now;
    }

    public void markNoShow(Instant now) {
        requireStatus(BookingStatus.NO_SHOW, BookingStatus.CONFIRMED);
        if (!BookingFeePolicy.isNoShowEligible(scheduledAt, now, status)) {
            throw new InvalidTransitionException(String.format(
                    "Booking %s cannot be marked NO_SHOW before %s", id, scheduledAt.plus(BookingFeePolicy.NO_SHOW_GRACE)));
        }
        cancellationFee = BookingFeePolicy.noShowFee(totalPrice);
        status = BookingStatus.NO_SHOW;
        updatedAt = now;
    }

    /**
     * Moves the booking and drops its resource; the caller allocates again for the new time.
     */
    public void reschedule(Instant newScheduledAt, Instant now) {
        if (!ACTIVE_BEFORE_START.contains(status)) {
            throw new InvalidTransitionException(String.format(
                    "Booking %s cannot be rescheduled in status %s", id, status));
        }
        if (newScheduledAt == null) {
            throw new InvalidInputException("New scheduled time is required");
        }
        if (newScheduledAt.isBefore(now.plus(MIN_RESCHEDULE_NOTICE))) {
            throw new InvalidInputException("Rescheduling requires at least "
                    + MIN_RESCHEDULE_NOTICE.toHours() + " hours notice");
        }
        requireWithinBookingHorizon(newScheduledAt, now);
        scheduledAt = newScheduledAt;
        clearAssignment();
        updatedAt = now;
    }

    public void addService(BookingServiceLine line, Instant now) {
        requireServiceEditable();
        if (line == null) {
            throw new InvalidInputException("Service is required");
        }
        List<BookingServiceLine> updated = new ArrayList<>(services);
        updated.add(line);
        validateServiceSet(updated);
        services.add(line);
        recalculateTotals();
        clearAssignment();
        updatedAt = now;
    }

    public void removeService(Long serviceId, Instant now) {
        requireServiceEditable();
        BookingServiceLine line = services.stream()
                .filter(s -> s.getServiceId().equals(serviceId))
                .findFirst()
                .orElseThrow(() -> new InvalidInputException(
                        "Service " + serviceId + " is not part of booking " + id));
        List<BookingServiceLine> updated = new ArrayList<>(services);
        updated.remove(line);
        validateServiceSet(updated);
        services.remove(line);
        recalculateTotals();
        clearAssignment();
        updatedAt = now;
    }

    public void updateNotes(String newNotes, Instant now) {
        if (!ACTIVE_BEFORE_START.contains(status)) {
            throw new InvalidTransitionException(String.format(
                    "Notes of booking %s can only change before it starts, status is %s", id, status));
        }
        if (newNotes != null && newNotes.length() > MAX_NOTES_LENGTH) {
            throw new InvalidInputException("Notes must not exceed " + MAX_NOTES_LENGTH + " characters");
        }
        notes = newNotes;
        updatedAt = now;
    }

    public void rate(int score, String feedbackText, Instant now) {
        if (status != BookingStatus.COMPLETED) {
            throw new InvalidTransitionException(String.format(
                    "Booking %s can only be rated once COMPLETED, status is %s", id, status));
        }
        if (rating != null) {
            throw new InvalidTransitionException("Booking " + id + " has already been rated");
        }
        if (score < 1 || score > 5) {
            throw new InvalidInputException("Rating must be between 1 and 5, got " + score);
        }
        if (feedbackText != null && feedbackText.length() > MAX_FEEDBACK_LENGTH) {
            throw new InvalidInputException("Feedback must not exceed " + MAX_FEEDBACK_LENGTH + " characters");
        }
        rating = score;
        feedback = feedbackText;
        updatedAt = now;
    }

    public void assignResource(ResourceRef resource) {
        Objects.requireNonNull(resource, "resource");
        if (resource.kind() != kind.resourceKind()) {
            throw new InvalidInputException(String.format(
                    "%s booking cannot be served by %s", kind, resource.kind()));
        }
        assignedResourceKind = resource.kind();
        assignedResourceId = resource.id();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean canBeCancelled() {
        return ACTIVE_BEFORE_START.contains(status);
    }

    public boolean canBeRescheduled(Instant now) {
        return ACTIVE_BEFORE_START.contains(status) && scheduledAt.isAfter(now.plus(MIN_RESCHEDULE_NOTICE));
    }

    /**
     * What the customer owes: the fee for CANCELLED and NO_SHOW, otherwise price plus overtime.
     */
    public BigDecimal finalAmount() {
        if (status == BookingStatus.CANCELLED || status == BookingStatus.NO_SHOW) {
            return cancellationFee;
        }
        return overtimeCharge == null ? totalPrice : totalPrice.add(overtimeCharge);
    }

    public Instant plannedEnd() {
        return scheduledAt.plus(Duration.ofMinutes(totalDurationMinutes));
    }

    public GeoLocation customerLocation() {
        if (customerLatitude == null || customerLongitude == null) {
            return null;
        }
        return new GeoLocation(customerLatitude, customerLongitude);
    }

    public ResourceRef assignedResource() {
        if (assignedResourceKind == null || assignedResourceId == null) {
            return null;
        }
        return new ResourceRef(assignedResourceKind, assignedResourceId);
    }

    public boolean isAllocated() {
        return assignedResource() != null;
    }

    public List<BookingServiceLine> getServices() {
        return Collections.unmodifiableList(services);
    }

    private void clearAssignment() {
        assignedResourceKind = null;
        assignedResourceId = null;
    }

    private void recalculateTotals() {
        totalPrice = services.stream()
                .map(BookingServiceLine::getPrice)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        totalDurationMinutes = services.stream()
                .mapToInt(BookingServiceLine::getDurationMinutes)
                .sum();
    }

    private void requireServiceEditable() {
        if (status != BookingStatus.PENDING) {
            throw new InvalidTransitionException(String.format(
                    "Services of booking %s can only change while PENDING, status is %s", id, status));
        }
    }

    private void requireStatus(BookingStatus target, BookingStatus... allowed) {
        for (BookingStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        throw new InvalidTransitionException(String.format(
                "Booking %s cannot move from %s to %s", id, status, target));
    }

    private static void requireWithinBookingHorizon(Instant scheduledAt, Instant now) {
        if (scheduledAt.isAfter(now.plus(MAX_ADVANCE))) {
            throw new InvalidInputException("Bookings can be made at most " + MAX_ADVANCE.toDays() + " days ahead");
        }
    }

    private static void validateServiceSet(List<BookingServiceLine> lines) {
        if (lines.size() < MIN_SERVICES || lines.size() > MAX_SERVICES) {
            throw new InvalidInputException(String.format(
                    "A booking needs between %d and %d services, got %d", MIN_SERVICES, MAX_SERVICES, lines.size()));
        }
        long distinct = lines.stream().map(BookingServiceLine::getServiceId).distinct().count();
        if (distinct != lines.size()) {
            throw new InvalidInputException("A service can only be booked once per booking");
        }
        BigDecimal price = BigDecimal.ZERO;
        int duration = 0;
        for (BookingServiceLine line : lines) {
            if (line.getPrice() == null || line.getPrice().signum() < 0 || line.getDurationMinutes() == null) {
                throw new InvalidInputException("Service " + line.getServiceId() + " has no valid price or duration");
            }
            price = price.add(line.getPrice());
            duration += line.getDurationMinutes();
        }
        if (duration < MIN_DURATION_MINUTES || duration > MAX_DURATION_MINUTES) {
            throw new InvalidInputException(String.format(
                    "Total duration must be between %d and %d minutes, got %d",
                    MIN_DURATION_MINUTES, MAX_DURATION_MINUTES, duration));
        }
        if (price.compareTo(MAX_TOTAL_PRICE) > 0) {
            throw new InvalidInputException("Total price must not exceed " + MAX_TOTAL_PRICE + ", got " + price);
        }
    }
}
