package kanban.email.app.model;

import lombok.Value;

import java.util.List;

@Value
public class LabelChange {
    List<String> addLabelIds;
    List<String> removeLabelIds;

    public boolean isEmpty() {
        return addLabelIds.isEmpty() && removeLabelIds.isEmpty();
    }
}
