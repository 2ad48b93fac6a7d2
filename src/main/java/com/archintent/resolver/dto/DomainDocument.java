package com.archintent.resolver.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class DomainDocument {
    private String name;
    private String responsibility;
    private String role;                                      // CORE (default), FRONTEND or INTEGRATION
    private Map<String, Integer> triggers = new LinkedHashMap<>(); // phrase -> weight, null = default weight
    private List<String> entities = new ArrayList<>();
    private List<String> components = new ArrayList<>();
}
