package com.ansible.visualizer.model;

/**
 * Flow direction token written into the diagram header.
 */
public enum LayoutDirection {
    /** Top to bottom. */
    TB,
    /** Top-down (alias of TB). */
    TD,
    /** Bottom to top. */
    BT,
    /** Right to left. */
    RL,
    /** Left to right. */
    LR
}
