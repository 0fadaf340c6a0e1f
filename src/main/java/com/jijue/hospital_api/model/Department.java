package com.jijue.hospital_api.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jijue.hospital_api.util.BusinessIds;

@Document("departments")
public class Department {
    @Id
    private String id;
    @Indexed(unique = true)
    private String name;
    private String description;
    private String icon = "🏥";
    private String headOfDepartment;
    private DepartmentContact contact = new DepartmentContact();
    private List<ServiceOffering> services = new ArrayList<>();
    private List<String> serviceList = new ArrayList<>();
    private OperatingHours operatingHours = new OperatingHours();
    private DepartmentStatus status = DepartmentStatus.ACTIVE;
    @JsonProperty("isActive")
    private boolean active = true;
    @Indexed(unique = true, sparse = true)
    private String departmentCode;
    private String floor = "Ground Floor";
    private Wing wing = Wing.CENTRAL;
    private Capacity capacity = new Capacity();
    private List<String> equipment = new ArrayList<>();
    private List<String> specializations = new ArrayList<>();
    private String colorCode = "#3B82F6";
    private Instant createdAt;
    private Instant updatedAt;

    public Department() {}

    public Department(String name, String description) {
        this.name = name;
        this.description = description;
    }

    /**
     * Fills the generated code, keeps {@code active} and {@code status} consistent
     * and mirrors service names into {@code serviceList}.
     */
    public void prepareForSave(long epochMillis) {
        if (name != null) {
            name = name.trim();
        }
        if (departmentCode == null || departmentCode.isBlank()) {
            departmentCode = BusinessIds.departmentCode(name, epochMillis);
        } else {
            departmentCode = departmentCode.trim().toUpperCase();
        }
        if (status == DepartmentStatus.INACTIVE || status == DepartmentStatus.CLOSED) {
            active = false;
        } else if (!active && status == DepartmentStatus.ACTIVE) {
            status = DepartmentStatus.INACTIVE;
        }
        serviceList = services.stream().map(ServiceOffering::getName).filter(Objects::nonNull).toList();
    }

    public String getCurrentStatus() {
        if (!active) return "Closed";
        if (status == DepartmentStatus.UNDER_MAINTENANCE) return "Under Maintenance";
        if (status == DepartmentStatus.INACTIVE) return "Inactive";
        return "Active";
    }

    public String getFormattedHours() {
        String hours = "Weekdays: " + operatingHours.getWeekdays() + " | Weekends: " + operatingHours.getWeekends();
        return operatingHours.isEmergency() ? hours + " | 24/7 Emergency" : hours;
    }

    public boolean isOpenAt(LocalDateTime now) {
        if (!active) {
            return false;
        }
        if (operatingHours.isEmergency()) {
            return true;
        }
        DayOfWeek day = now.getDayOfWeek();
        boolean weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
        OperatingHours.Window window = weekend ? operatingHours.getWeekends() : operatingHours.getWeekdays();
        return window != null && window.contains(now.getHour() * 60 + now.getMinute());
    }

    // Getters
    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getIcon() { return icon; }
    public String getHeadOfDepartment() { return headOfDepartment; }
    public DepartmentContact getContact() { return contact; }
    public List<ServiceOffering> getServices() { return services; }
    public List<String> getServiceList() { return serviceList; }
    public OperatingHours getOperatingHours() { return operatingHours; }
    public DepartmentStatus getStatus() { return status; }
    public boolean isActive() { return active; }
    public String getDepartmentCode() { return departmentCode; }
    public String getFloor() { return floor; }
    public Wing getWing() { return wing; }
    public Capacity getCapacity() { return capacity; }
    public List<String> getEquipment() { return equipment; }
    public List<String> getSpecializations() { return specializations; }
    public String getColorCode() { return colorCode; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setDescription(String description) { this.description = description; }
    public void setIcon(String icon) { this.icon = icon; }
    public void setHeadOfDepartment(String headOfDepartment) { this.headOfDepartment = headOfDepartment; }
    public void setContact(DepartmentContact contact) { this.contact = contact; }
    public void setServices(List<ServiceOffering> services) { this.services = services != null ? services : new ArrayList<>(); }
    public void setServiceList(List<String> serviceList) { this.serviceList = serviceList; }
    public void setOperatingHours(OperatingHours operatingHours) { this.operatingHours = operatingHours != null ? operatingHours : new OperatingHours(); }
    public void setStatus(DepartmentStatus status) { this.status = status; }
    public void setActive(boolean active) { this.active = active; }
    public void setDepartmentCode(String departmentCode) { this.departmentCode = departmentCode; }
    public void setFloor(String floor) { this.floor = floor; }
    public void setWing(Wing wing) { this.wing = wing; }
    public void setCapacity(Capacity capacity) { this.capacity = capacity; }
    public void setEquipment(List<String> equipment) { this.equipment = equipment; }
    public void setSpecializations(List<String> specializations) { this.specializations = specializations; }
    public void setColorCode(String colorCode) { this.colorCode = colorCode; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Department that = (Department) o;
        if (id == null || that.id == null) {
            return false;
        }
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
