package kanban.email.app.service;

public class ColumnNotFoundException extends RuntimeException {
    public ColumnNotFoundException(String columnId) {
        super("Kanban column not found: " + columnId);
    }
}
