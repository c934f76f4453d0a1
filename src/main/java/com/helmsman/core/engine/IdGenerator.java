package com.helmsman.core.engine;

/**
 * Source of unique processing result identifiers.
 */
@FunctionalInterface
public interface IdGenerator {
    String nextId();
}
