package com.brush.matching.catalog;

/**
 * Runtime exception thrown when a catalog or override file is missing,
 * unreadable or malformed. These are configuration defects and are never retried.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Builds an exception naming the offending catalog location.
     */
    public static CatalogException at(String section, String brand, String model, String detail) {
        return new CatalogException(describe(section, brand, model) + ": " + detail);
    }

    /**
     * Builds an exception for a pattern that failed to compile.
     */
    public static CatalogException invalidPattern(String section, String brand, String model,
                                                  String pattern, Throwable cause) {
        return new CatalogException(describe(section, brand, model)
                + ": invalid pattern '" + pattern + "': " + cause.getMessage(), cause);
    }

    private static String describe(String section, String brand, String model) {
        StringBuilder sb = new StringBuilder("catalog[").append(section).append(']');
        if (brand != null) {
            sb.append(" brand='").append(brand).append('\'');
        }
        if (model != null) {
            sb.append(" model='").append(model).append('\'');
        }
        return sb.toString();
    }
}
