package com.loglens.fields;

public enum FieldOrigin {
    /** Column of the event table. */
    CORE,
    /** Key found in the structured_data JSON column by the discovery scan. */
    DISCOVERED
}
