package com.tablecraft.api;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
public class SchemaRequest {
    @NotNull(message = "Data is required")
    private List<Map<String, Object>> data = new ArrayList<>();
}
