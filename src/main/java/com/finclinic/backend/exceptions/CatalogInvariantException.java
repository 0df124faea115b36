package com.finclinic.backend.exceptions;

/**
 * Raised while initialising a question catalog or insight matrix whose content breaks a
 * structural rule (weights not summing to 100, a bucket without a default text, ...).
 * Startup must not continue past it.
 */
public class CatalogInvariantException extends Exception {

    public CatalogInvariantException(String message) {
        super(message);
    }
}
