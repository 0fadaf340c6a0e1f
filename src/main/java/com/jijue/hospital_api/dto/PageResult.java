package com.jijue.hospital_api.dto;

import java.util.List;

public record PageResult<T>(List<T> items, Pagination pagination) {
}
