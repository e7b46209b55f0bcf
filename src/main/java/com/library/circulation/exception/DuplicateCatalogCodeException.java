package com.library.circulation.exception;

public class DuplicateCatalogCodeException extends CirculationException {

    public DuplicateCatalogCodeException(String catalogCode) {
        super("DUPLICATE_CATALOG_CODE", "Catalog code already exists: " + catalogCode);
    }
}
