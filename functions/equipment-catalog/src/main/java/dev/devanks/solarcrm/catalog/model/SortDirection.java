package dev.devanks.solarcrm.catalog.model;

public enum SortDirection {
    ASC,
    DESC
}
