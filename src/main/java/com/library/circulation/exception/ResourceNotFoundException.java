package com.library.circulation.exception;

import java.util.Locale;

/**
 * Covers StudentNotFound, RecordNotFound and missing books or copies. The code is derived
 * from the entity name, e.g. {@code STUDENT_NOT_FOUND}.
 */
public class ResourceNotFoundException extends CirculationException {

    public ResourceNotFoundException(String entityName, Long id) {
        super(codeFor(entityName), entityName + " not found with id " + id);
    }

    private static String codeFor(String entityName) {
        return entityName.trim().toUpperCase(Locale.ROOT).replace(' ', '_') + "_NOT_FOUND";
    }
}
