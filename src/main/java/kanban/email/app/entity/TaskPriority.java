package kanban.email.app.entity;

public enum TaskPriority {
    HIGH("🔴"),
    MEDIUM("🟡"),
    LOW("🟢");

    private final String marker;

    TaskPriority(String marker) {
        this.marker = marker;
    }

    public String getMarker() {
        return marker;
    }

    public static TaskPriority parse(String value) {
        if (value == null) {
            return MEDIUM;
        }
        switch (value.trim().toLowerCase()) {
            case "high":
                return HIGH;
            case "low":
                return LOW;
            default:
                return MEDIUM;
        }
    }
}
