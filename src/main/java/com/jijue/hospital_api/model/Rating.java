package com.jijue.hospital_api.model;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class Rating {
    private double average;
    private int totalReviews;
    // keys "1".."5"
    private Map<String, Integer> breakdown = emptyBreakdown();

    public void add(int stars) {
        if (stars < 1 || stars > 5) {
            throw new IllegalArgumentException("Rating must be between 1 and 5");
        }
        if (breakdown == null) {
            breakdown = emptyBreakdown();
        }
        breakdown.merge(String.valueOf(stars), 1, Integer::sum);

        int count = 0;
        int sum = 0;
        for (Map.Entry<String, Integer> entry : breakdown.entrySet()) {
            count += entry.getValue();
            sum += Integer.parseInt(entry.getKey()) * entry.getValue();
        }
        totalReviews = count;
        average = count == 0 ? 0 : Math.round(sum * 10.0 / count) / 10.0;
    }

    private static Map<String, Integer> emptyBreakdown() {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (int i = 1; i <= 5; i++) {
            map.put(String.valueOf(i), 0);
        }
        return map;
    }
}
