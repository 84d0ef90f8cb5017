package org.hwviz.util;

/** Marker interface for classes that produce output through the {@link Logger}. */
public interface IWritesLogs {}
