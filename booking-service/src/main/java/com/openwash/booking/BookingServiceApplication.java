package com.openwash.booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {"com.openwash.booking", "com.openwash.capacity", "com.openwash.common"})
@EnableJpaRepositories(basePackages = {"com.openwash.booking.domain.repository", "com.openwash.capacity.domain.repository"})
@EntityScan(basePackages = {"com.openwash.booking.domain.model", "com.openwash.capacity.domain.model"})
@EnableFeignClients
@EnableScheduling
public class BookingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookingServiceApplication.class, args);
    }
}
