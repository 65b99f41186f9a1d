package com.openwash.booking.domain.repository;

import com.openwash.booking.api.dto.BookingSearchCriteria;
import com.openwash.booking.domain.model.Booking;
import com.openwash.booking.domain.model.BookingStatus;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;

public final class BookingSpecification {

    private BookingSpecification() {
    }

    public static Specification<Booking> withCriteria(BookingSearchCriteria criteria) {
        return Specification
                .where(hasCustomer(criteria.customerId()))
                .and(hasStatus(criteria.status()))
                .and(scheduledAtOrAfter(criteria.from()))
                .and(scheduledAtOrBefore(criteria.to()));
    }

    public static Specification<Booking> hasCustomer(Long customerId) {
        return (root, query, cb) -> {
            if (customerId == null) {
                return null;
            }
            return cb.equal(root.get("customerId"), customerId);
        };
    }

    public static Specification<Booking> hasStatus(BookingStatus status) {
        return (root, query, cb) -> {
            if (status == null) {
                return null;
            }
            return cb.equal(root.get("status"), status);
        };
    }

    public static Specification<Booking> scheduledAtOrAfter(Instant from) {
        return (root, query, cb) -> {
            if (from == null) {
                return null;
            }
            return cb.greaterThanOrEqualTo(root.get("scheduledAt"), from);
        };
    }

    public static Specification<Booking> scheduledAtOrBefore(Instant to) {
        return (root, query, cb) -> {
            if (to == null) {
                return null;
            }
            return cb.lessThanOrEqualTo(root.get("scheduledAt"), to);
        };
    }
}
