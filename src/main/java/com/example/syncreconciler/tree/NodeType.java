package com.example.syncreconciler.tree;

/**
 * Kind of filesystem object a tracked entry or live entry represents.
 */
public enum NodeType {
    FILE,
    FOLDER,
    UNKNOWN
}
