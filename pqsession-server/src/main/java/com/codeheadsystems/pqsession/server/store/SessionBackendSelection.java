package com.codeheadsystems.pqsession.server.store;

/**
 * The store chosen at startup.
 *
 * @param store    the store
 * @param degraded true if a durable backend was requested but the local one is in use
 * @param detail   human readable description of the choice
 */
public record SessionBackendSelection(SessionStore store, boolean degraded, String detail) {
}
