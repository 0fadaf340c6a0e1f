package com.jijue.hospital_api.repository;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.jijue.hospital_api.model.ContactInfo;

@Repository
public interface ContactInfoRepository extends MongoRepository<ContactInfo, String> {
    Optional<ContactInfo> findFirstByOrderByIdAsc();
}
