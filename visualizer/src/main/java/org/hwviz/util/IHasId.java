package org.hwviz.util;

/** An object with a unique numeric identifier. */
public interface IHasId {
    long getId();
}
