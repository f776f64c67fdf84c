package io.dispatcher;

/**
 * Well-known namespace names.
 */
public final class Namespaces {

    /** Default namespace used when none is given. */
    public static final String GLOBAL = "global";

    public static final String LOCAL = "local";

    private Namespaces() {}
}
