package kanban.email.app.service;

import kanban.email.app.entity.ColumnAssignment;
import kanban.email.app.entity.KanbanColumn;
import kanban.email.app.repository.KanbanColumnRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * User-defined board columns and their Gmail label policy.
 */
@Slf4j
@Service
public class KanbanColumnService {
    private static final Set<String> BUILT_IN_COLUMNS = Set.of(ColumnAssignment.INBOX, ColumnAssignment.SNOOZED);

    private final KanbanColumnRepository kanbanColumnRepository;
    private final ColumnAssignmentService columnAssignmentService;

    public KanbanColumnService(KanbanColumnRepository kanbanColumnRepository,
                               ColumnAssignmentService columnAssignmentService) {
        this.kanbanColumnRepository = kanbanColumnRepository;
        this.columnAssignmentService = columnAssignmentService;
    }

    /**
     * Columns ordered for display. A user without columns gets the default board.
     */
    @Transactional
    public List<KanbanColumn> listColumns(String userId) {
        List<KanbanColumn> columns = kanbanColumnRepository.findByUserIdOrderByDisplayOrderAsc(userId);
        if (!columns.isEmpty()) {
            return columns;
        }
        log.info("Creating default Kanban columns for user {}", userId);
        List<KanbanColumn> defaults = new ArrayList<>();
        defaults.add(newColumn(userId, ColumnAssignment.INBOX, "Inbox", 0, "INBOX", List.of("INBOX")));
        defaults.add(newColumn(userId, "todo", "To Do", 1, "IMPORTANT", List.of("IMPORTANT")));
        defaults.add(newColumn(userId, "done", "Done", 2, "STARRED", List.of("STARRED")));
        defaults.add(newColumn(userId, ColumnAssignment.SNOOZED, "Snoozed", 3, null, List.of()));
        return kanbanColumnRepository.saveAll(defaults);
    }

    @Transactional(readOnly = true)
    public Optional<KanbanColumn> findColumn(String userId, String columnId) {
        if (columnId == null || columnId.isEmpty()) {
            return Optional.empty();
        }
        return kanbanColumnRepository.findByUserIdAndColumnId(userId, columnId);
    }

    @Transactional
    public KanbanColumn createColumn(String userId, String columnId, String name,
                                     String gmailLabelId, List<String> removeLabelIds) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be empty");
        }
        String id = columnId == null || columnId.isBlank()
            ? "col-" + UUID.randomUUID().toString().substring(0, 8)
            : columnId;
        if (kanbanColumnRepository.existsByUserIdAndColumnId(userId, id)) {
            throw new IllegalArgumentException("Column already exists: " + id);
        }
        int nextOrder = kanbanColumnRepository.findByUserIdOrderByDisplayOrderAsc(userId).stream()
            .mapToInt(KanbanColumn::getDisplayOrder)
            .max()
            .orElse(-1) + 1;
        return kanbanColumnRepository.save(newColumn(userId, id, name, nextOrder, gmailLabelId, removeLabelIds));
    }

    @Transactional
    public KanbanColumn updateColumn(String userId, String columnId, String name,
                                     String gmailLabelId, List<String> removeLabelIds) {
        KanbanColumn column = findColumn(userId, columnId)
            .orElseThrow(() -> new ColumnNotFoundException(columnId));
        if (name != null && !name.isBlank()) {
            column.setName(name);
        }
        column.setGmailLabelId(gmailLabelId);
        column.setRemoveLabelIds(removeLabelIds != null ? new ArrayList<>(removeLabelIds) : new ArrayList<>());
        return kanbanColumnRepository.save(column);
    }

    @Transactional
    public void reorderColumns(String userId, Map<String, Integer> orders) {
        for (Map.Entry<String, Integer> entry : orders.entrySet()) {
            KanbanColumn column = findColumn(userId, entry.getKey())
                .orElseThrow(() -> new ColumnNotFoundException(entry.getKey()));
            column.setDisplayOrder(entry.getValue());
            kanbanColumnRepository.save(column);
        }
    }

    /**
     * Deletes a user column. Emails still assigned to it fall back to the inbox.
     */
    @Transactional
    public int deleteColumn(String userId, String columnId) {
        if (BUILT_IN_COLUMNS.contains(columnId)) {
            throw new IllegalArgumentException("Built-in column cannot be deleted: " + columnId);
        }
        if (!kanbanColumnRepository.existsByUserIdAndColumnId(userId, columnId)) {
            throw new ColumnNotFoundException(columnId);
        }
        int reassigned = columnAssignmentService.reassignColumn(userId, columnId, ColumnAssignment.INBOX);
        kanbanColumnRepository.deleteColumn(userId, columnId);
        log.info("Deleted column {} for user {}, moved {} email(s) to inbox", columnId, userId, reassigned);
        return reassigned;
    }

    private KanbanColumn newColumn(String userId, String columnId, String name, int order,
                                   String gmailLabelId, List<String> removeLabelIds) {
        KanbanColumn column = new KanbanColumn();
        column.setUserId(userId);
        column.setColumnId(columnId);
        column.setName(name);
        column.setDisplayOrder(order);
        column.setGmailLabelId(gmailLabelId);
        column.setRemoveLabelIds(removeLabelIds != null ? new ArrayList<>(removeLabelIds) : new ArrayList<>());
        return column;
    }
}
