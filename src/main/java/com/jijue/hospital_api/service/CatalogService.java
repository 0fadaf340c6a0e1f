package com.jijue.hospital_api.service;

import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Pattern;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.dto.ServiceCategory;
import com.jijue.hospital_api.model.HospitalService;
import com.jijue.hospital_api.repository.HospitalServiceRepository;

/**
 * Read-only catalogue of the services the hospital offers.
 */
@Service
public class CatalogService {

    private final HospitalServiceRepository hospitalServiceRepository;
    private final MongoTemplate mongoTemplate;

    public CatalogService(HospitalServiceRepository hospitalServiceRepository, MongoTemplate mongoTemplate) {
        this.hospitalServiceRepository = hospitalServiceRepository;
        this.mongoTemplate = mongoTemplate;
    }

    public List<HospitalService> getServices(String category, String search) {
        Query query = new Query(Criteria.where("active").is(true));
        if (category != null && !category.isBlank()) {
            query.addCriteria(Criteria.where("category").regex(
                    Pattern.compile("^" + Pattern.quote(category.trim()) + "$", Pattern.CASE_INSENSITIVE)));
        }
        if (search != null && !search.isBlank()) {
            Pattern pattern = Pattern.compile(Pattern.quote(search.trim()), Pattern.CASE_INSENSITIVE);
            query.addCriteria(new Criteria().orOperator(
                    Criteria.where("name").regex(pattern),
                    Criteria.where("description").regex(pattern),
                    Criteria.where("category").regex(pattern)));
        }
        return mongoTemplate.find(query.with(Sort.by(Sort.Direction.ASC, "name")), HospitalService.class);
    }

    public List<ServiceCategory> getCategories() {
        Query active = new Query(Criteria.where("active").is(true));
        return mongoTemplate.findDistinct(active, "category", HospitalService.class, String.class).stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.naturalOrder())
                .map(name -> new ServiceCategory(name.toLowerCase(), name))
                .toList();
    }

    public HospitalService getService(String id) {
        return hospitalServiceRepository.findByIdAndActiveTrue(id)
                .orElseThrow(() -> new NoSuchElementException("Service not found"));
    }
}
