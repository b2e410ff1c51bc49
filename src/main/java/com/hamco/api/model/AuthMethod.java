package com.hamco.api.model;

/**
 * How the current principal proved its identity.
 */
public enum AuthMethod {
    TOKEN("token"),
    API_KEY("key");

    private final String tag;

    AuthMethod(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
