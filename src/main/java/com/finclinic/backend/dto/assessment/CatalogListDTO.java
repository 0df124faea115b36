package com.finclinic.backend.dto.assessment;

import java.util.List;

public record CatalogListDTO(String defaultRevision, List<String> revisions) {}
