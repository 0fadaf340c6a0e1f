package com.jijue.hospital_api.repository;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.jijue.hospital_api.model.HospitalService;

@Repository
public interface HospitalServiceRepository extends MongoRepository<HospitalService, String> {
    Optional<HospitalService> findByIdAndActiveTrue(String id);
}
