package com.jijue.hospital_api.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.dto.DepartmentAvailability;
import com.jijue.hospital_api.dto.DepartmentUpdateRequest;
import com.jijue.hospital_api.model.Department;
import com.jijue.hospital_api.model.DepartmentStatus;
import com.jijue.hospital_api.model.Doctor;
import com.jijue.hospital_api.model.DoctorStatus;
import com.jijue.hospital_api.model.ServiceOffering;
import com.jijue.hospital_api.model.Specialization;
import com.jijue.hospital_api.model.Wing;
import com.jijue.hospital_api.repository.DepartmentRepository;

@Service
public class DepartmentService {

    private static final Logger logger = LoggerFactory.getLogger(DepartmentService.class);

    private static final Sort BY_NAME = Sort.by(Sort.Direction.ASC, "name");

    private final DepartmentRepository departmentRepository;
    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public DepartmentService(DepartmentRepository departmentRepository, MongoTemplate mongoTemplate, Clock clock) {
        this.departmentRepository = departmentRepository;
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    public List<Department> getDepartments(Boolean active, Boolean emergency, String floor) {
        Query query = new Query();
        if (active != null) {
            query.addCriteria(Criteria.where("active").is(active));
        }
        if (emergency != null) {
            query.addCriteria(Criteria.where("operatingHours.emergency").is(emergency));
        }
        if (floor != null && !floor.isBlank()) {
            query.addCriteria(Criteria.where("floor").is(floor));
        }
        return mongoTemplate.find(query.with(BY_NAME), Department.class);
    }

    public List<Department> getActiveDepartments() {
        return getDepartments(true, null, null);
    }

    public List<Department> getEmergencyDepartments() {
        return getDepartments(true, true, null);
    }

    public Department getDepartmentById(String id) {
        return departmentRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Department not found"));
    }

    public Department getByCode(String code) {
        return departmentRepository.findByDepartmentCode(code.trim().toUpperCase())
                .orElseThrow(() -> new NoSuchElementException("Department not found"));
    }

    public Department createDepartment(Department department) {
        if (department.getName() == null || department.getName().isBlank()) {
            throw new IllegalArgumentException("Department name is required");
        }
        if (departmentRepository.findByNameIgnoreCase(department.getName().trim()).isPresent()) {
            logger.warn("Department name {} already taken", department.getName());
            throw new IllegalArgumentException("Department with this name already exists");
        }
        department.setId(null);
        department.prepareForSave(clock.millis());
        Instant now = clock.instant();
        department.setCreatedAt(now);
        department.setUpdatedAt(now);
        Department saved = departmentRepository.save(department);
        logger.info("Department {} ({}) created", saved.getName(), saved.getDepartmentCode());
        return saved;
    }

    /**
     * Applies only the fields present in the request; a renamed department must keep a unique name.
     */
    public Department updateDepartment(String id, DepartmentUpdateRequest update) {
        Department existing = getDepartmentById(id);
        if (update.name() != null && !update.name().isBlank()) {
            departmentRepository.findByNameIgnoreCase(update.name().trim())
                    .filter(other -> !other.getId().equals(id))
                    .ifPresent(other -> {
                        logger.warn("Rename of department {} onto taken name {}", id, update.name());
                        throw new IllegalArgumentException("Department with this name already exists");
                    });
            existing.setName(update.name().trim());
        }
        if (update.description() != null) existing.setDescription(update.description());
        if (update.icon() != null) existing.setIcon(update.icon());
        if (update.headOfDepartment() != null) existing.setHeadOfDepartment(update.headOfDepartment());
        if (update.contact() != null) existing.setContact(update.contact());
        if (update.services() != null) existing.setServices(update.services());
        if (update.operatingHours() != null) existing.setOperatingHours(update.operatingHours());
        if (update.status() != null) {
            DepartmentStatus status = DepartmentStatus.fromValue(update.status());
            existing.setStatus(status);
            if (update.isActive() == null) {
                existing.setActive(status != DepartmentStatus.INACTIVE && status != DepartmentStatus.CLOSED);
            }
        }
        if (update.isActive() != null) {
            existing.setActive(update.isActive());
            boolean closedStatus = existing.getStatus() == DepartmentStatus.INACTIVE
                    || existing.getStatus() == DepartmentStatus.CLOSED;
            if (update.isActive() && update.status() == null && closedStatus) {
                existing.setStatus(DepartmentStatus.ACTIVE);
            }
        }
        if (update.departmentCode() != null) existing.setDepartmentCode(update.departmentCode());
        if (update.floor() != null) existing.setFloor(update.floor());
        if (update.wing() != null) existing.setWing(Wing.fromValue(update.wing()));
        if (update.capacity() != null) existing.setCapacity(update.capacity());
        if (update.equipment() != null) existing.setEquipment(update.equipment());
        if (update.specializations() != null) existing.setSpecializations(update.specializations());
        if (update.colorCode() != null) existing.setColorCode(update.colorCode());

        existing.prepareForSave(clock.millis());
        existing.setUpdatedAt(clock.instant());
        logger.info("Department {} updated", existing.getDepartmentCode());
        return departmentRepository.save(existing);
    }

    /** Soft delete: doctors and appointments keep their reference. */
    public void deactivateDepartment(String id) {
        Department department = getDepartmentById(id);
        department.setActive(false);
        department.setStatus(DepartmentStatus.INACTIVE);
        department.setUpdatedAt(clock.instant());
        departmentRepository.save(department);
        logger.warn("Department {} deactivated", department.getName());
    }

    /**
     * Active doctors of the department, best rated first, ties broken by experience.
     */
    public List<Doctor> getDepartmentDoctors(String id, Boolean available, String specialization) {
        Department department = getDepartmentById(id);
        List<Criteria> filters = new ArrayList<>();
        filters.add(Criteria.where("department").is(department.getId()));
        filters.add(Criteria.where("status").is(DoctorStatus.ACTIVE.name()));
        if (available != null) {
            filters.add(Criteria.where("available").is(available));
        }
        if (specialization != null && !specialization.isBlank()) {
            filters.add(Criteria.where("specialization").is(Specialization.fromValue(specialization).name()));
        }
        Query query = new Query(new Criteria().andOperator(filters.toArray(new Criteria[0])))
                .with(Sort.by(Sort.Order.desc("rating.average"), Sort.Order.desc("yearsOfExperience")));
        List<Doctor> doctors = mongoTemplate.find(query, Doctor.class);
        LocalDateTime now = LocalDateTime.now(clock);
        doctors.forEach(d -> d.refreshNextAvailable(now));
        return doctors;
    }

    public Department addService(String id, ServiceOffering service) {
        if (service == null || service.getName() == null || service.getName().isBlank()) {
            throw new IllegalArgumentException("Service name is required");
        }
        Department department = getDepartmentById(id);
        department.getServices().add(service);
        department.prepareForSave(clock.millis());
        department.setUpdatedAt(clock.instant());
        logger.info("Service {} added to department {}", service.getName(), department.getName());
        return departmentRepository.save(department);
    }

    public DepartmentAvailability getAvailability(String id) {
        Department department = getDepartmentById(id);
        return new DepartmentAvailability(
                department.isOpenAt(LocalDateTime.now(clock)),
                department.getCurrentStatus(),
                department.getOperatingHours(),
                department.getFormattedHours(),
                department.getOperatingHours().isEmergency());
    }
}
