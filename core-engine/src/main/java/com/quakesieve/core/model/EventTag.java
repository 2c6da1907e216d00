package com.quakesieve.core.model;

/**
 * Classification outcome of a single event.
 *
 * @since 1.0.0
 */
public enum EventTag {

    /** Mainshock: not triggered by any qualifying parent. */
    INDEPENDENT,

    /** Aftershock or foreshock: inside a qualifying parent's window. */
    DEPENDENT
}
