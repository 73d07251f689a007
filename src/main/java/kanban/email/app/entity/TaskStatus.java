package kanban.email.app.entity;

public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED
}
