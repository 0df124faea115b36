package com.finclinic.backend.services.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.finclinic.backend.exceptions.BadRequestException;
import com.finclinic.backend.exceptions.CatalogInvariantException;

/**
 * Initialised catalog revisions, keyed by revision id.
 */
public final class QuestionCatalogRegistry {

    private final Map<String, QuestionCatalog> catalogs;
    private final QuestionCatalog defaultCatalog;

    public QuestionCatalogRegistry(Collection<QuestionCatalog> catalogs, String defaultRevision) throws CatalogInvariantException {
        Map<String, QuestionCatalog> byRevision = new LinkedHashMap<>();
        for (QuestionCatalog catalog : catalogs) {
            if (byRevision.putIfAbsent(catalog.revision(), catalog) != null) {
                throw new CatalogInvariantException("Catalog revision registered twice: " + catalog.revision());
            }
        }
        QuestionCatalog fallback = byRevision.get(defaultRevision);
        if (fallback == null) {
            throw new CatalogInvariantException(
                    "Default catalog revision '" + defaultRevision + "' is not one of " + byRevision.keySet());
        }
        this.catalogs = Collections.unmodifiableMap(byRevision);
        this.defaultCatalog = fallback;
    }

    public QuestionCatalog defaultCatalog() {
        return defaultCatalog;
    }

    public Optional<QuestionCatalog> find(String revision) {
        if (revision == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(catalogs.get(revision.trim()));
    }

    /**
     * The requested revision, or the default one when {@code revision} is null or blank.
     */
    public QuestionCatalog resolve(String revision) {
        if (revision == null || revision.isBlank()) {
            return defaultCatalog;
        }
        return find(revision)
                .orElseThrow(() -> new BadRequestException("Unknown question catalog revision: " + revision));
    }

    public List<String> revisions() {
        return List.copyOf(catalogs.keySet());
    }
}
