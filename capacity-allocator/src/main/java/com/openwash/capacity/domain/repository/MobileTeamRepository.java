package com.openwash.capacity.domain.repository;

import com.openwash.capacity.domain.model.MobileTeam;
import com.openwash.capacity.domain.model.ResourceStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface MobileTeamRepository extends JpaRepository<MobileTeam, Long> {

    /** Radius filtering happens in memory; the fleet is small. */
    List<MobileTeam> findByStatusOrderByIdAsc(ResourceStatus status);
}
