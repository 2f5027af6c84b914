package com.sc360.reportrefresh.service;

/**
 * Turns engine error text into the fragment stored in error_message.
 */
public final class ErrorMessages {

    private static final int MAX_LENGTH = 1000;

    private ErrorMessages() {
    }

    /**
     * Redshift errors look like "ERROR: relation \"x\" does not exist"; keep what follows the first colon.
     */
    public static String fragment(String error) {
        if (error == null || error.isBlank()) {
            return "Unknown error";
        }
        int colon = error.indexOf(':');
        String fragment = colon >= 0 ? error.substring(colon + 1).trim() : error.trim();
        if (fragment.isEmpty()) {
            fragment = error.trim();
        }
        return fragment.length() > MAX_LENGTH ? fragment.substring(0, MAX_LENGTH) : fragment;
    }
}
