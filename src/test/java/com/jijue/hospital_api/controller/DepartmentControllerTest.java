package com.jijue.hospital_api.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.jijue.hospital_api.exception.GlobalExceptionHandler;
import com.jijue.hospital_api.model.Department;
import com.jijue.hospital_api.service.DepartmentService;

@ExtendWith(MockitoExtension.class)
class DepartmentControllerTest {

    @Mock
    private DepartmentService departmentService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new DepartmentController(departmentService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void listsDepartmentsWithCount() throws Exception {
        Department cardiology = new Department("Cardiology", "Heart care");
        cardiology.setDepartmentCode("C1234");
        when(departmentService.getDepartments(true, null, null)).thenReturn(List.of(cardiology));

        mockMvc.perform(get("/api/departments").param("active", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.data[0].name").value("Cardiology"))
                .andExpect(jsonPath("$.data[0].currentStatus").value("Active"))
                .andExpect(jsonPath("$.data[0].isActive").value(true));
    }

    @Test
    void unknownDepartmentIsNotFound() throws Exception {
        when(departmentService.getDepartmentById("missing"))
                .thenThrow(new NoSuchElementException("Department not found"));

        mockMvc.perform(get("/api/departments/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Department not found"));
    }

    @Test
    void creationAnswersCreated() throws Exception {
        Department saved = new Department("Oncology", null);
        saved.setId("dep-1");
        when(departmentService.createDepartment(any(Department.class))).thenReturn(saved);

        mockMvc.perform(post("/api/departments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Oncology\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.id").value("dep-1"));
    }

    @Test
    void duplicateNameIsBadRequest() throws Exception {
        when(departmentService.createDepartment(any(Department.class)))
                .thenThrow(new IllegalArgumentException("Department with this name already exists"));

        mockMvc.perform(post("/api/departments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Oncology\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Department with this name already exists"));
    }

    @Test
    void deleteDeactivates() throws Exception {
        mockMvc.perform(delete("/api/departments/dep-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Department deactivated successfully"));

        verify(departmentService).deactivateDepartment("dep-1");
    }
}
