package org.opensearch.snapshotmanager.lifecycle;

public enum AgeClassification {
    OLDER,
    NOT_OLDER,
    /** The name carries no strict yyyy.MM.dd date after its last '-' */
    UNPARSEABLE
}
