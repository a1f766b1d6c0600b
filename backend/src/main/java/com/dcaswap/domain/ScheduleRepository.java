package com.dcaswap.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for schedules. Claiming and run bookkeeping go through {@link ScheduleRepositoryCustom}.
 */
public interface ScheduleRepository extends MongoRepository<Schedule, String>, ScheduleRepositoryCustom {

    List<Schedule> findByPkpInfoEthAddressOrderByCreatedAtDesc(String ethAddress);
}
