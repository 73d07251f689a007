package kanban.email.app.entity;

public enum SyncStatus {
    ACTIVE,
    EXPIRED,
    ERROR
}
