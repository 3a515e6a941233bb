package com.taskgraph.core.model;

/**
 * Network bandwidth class a node may claim. Each class has its own slot budget.
 */
public enum NetworkClass {
    LOW,
    STANDARD,
    HIGH
}
