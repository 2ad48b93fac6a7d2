package com.archintent.resolver.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class LexiconDocument {
    private Map<String, String> actions = new LinkedHashMap<>();   // verb -> ActionCategory
    private List<String> qualifiers = new ArrayList<>();
}
