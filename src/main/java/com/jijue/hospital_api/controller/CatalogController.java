package com.jijue.hospital_api.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.jijue.hospital_api.model.HospitalService;
import com.jijue.hospital_api.service.CatalogService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/services")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogService catalogService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> getServices(@RequestParam(required = false) String category,
                                                           @RequestParam(required = false) String search) {
        List<HospitalService> services = catalogService.getServices(category, search);
        return ResponseEntity.ok(Map.of("success", true, "count", services.size(), "data", services));
    }

    @GetMapping("/categories")
    public ResponseEntity<Map<String, Object>> getCategories() {
        return ResponseEntity.ok(Map.of("success", true, "data", catalogService.getCategories()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getService(@PathVariable String id) {
        return ResponseEntity.ok(Map.of("success", true, "data", catalogService.getService(id)));
    }
}
