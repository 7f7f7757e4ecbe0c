package io.clipboardstore.core;

/**
 * Storage namespace a clipboard root lives in.
 */
public enum Namespace {
    /** Survives reboots; rooted under the user's state directory. */
    PERSISTENT,
    /** Rooted under the system temporary directory. */
    TEMPORARY
}
