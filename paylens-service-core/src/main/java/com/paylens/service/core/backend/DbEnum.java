package com.paylens.service.core.backend;

/** Enum whose constants are stored as a fixed text value in the analytics tables. */
public interface DbEnum {
    String dbValue();
}
