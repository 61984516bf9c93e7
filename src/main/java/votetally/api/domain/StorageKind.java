package votetally.api.domain;

public enum StorageKind {
    QUEUE,
    RELATIONAL
}
