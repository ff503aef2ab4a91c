package com.callplane.core.model;

/**
 * Health of an Asterisk node as last reported by the catalog.
 */
public enum NodeStatus {
    OK,
    KO
}
