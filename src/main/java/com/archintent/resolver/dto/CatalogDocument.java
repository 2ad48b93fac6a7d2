package com.archintent.resolver.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class CatalogDocument {
    private List<ComponentDocument> components = new ArrayList<>();
}
