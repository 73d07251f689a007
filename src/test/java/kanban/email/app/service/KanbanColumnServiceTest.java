package kanban.email.app.service;

import kanban.email.app.entity.KanbanColumn;
import kanban.email.app.repository.KanbanColumnRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KanbanColumnServiceTest {

    @Mock
    private KanbanColumnRepository kanbanColumnRepository;

    @Mock
    private ColumnAssignmentService columnAssignmentService;

    @InjectMocks
    private KanbanColumnService kanbanColumnService;

    private static KanbanColumn column(String id, int order) {
        KanbanColumn column = new KanbanColumn();
        column.setUserId("u1");
        column.setColumnId(id);
        column.setName(id);
        column.setDisplayOrder(order);
        return column;
    }

    @Test
    void listColumns_ForNewUser_ShouldSeedDefaultBoard() {
        // Given
        when(kanbanColumnRepository.findByUserIdOrderByDisplayOrderAsc("u1")).thenReturn(List.of());
        when(kanbanColumnRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        List<KanbanColumn> columns = kanbanColumnService.listColumns("u1");

        // Then
        assertEquals(List.of("inbox", "todo", "done", "snoozed"),
            columns.stream().map(KanbanColumn::getColumnId).collect(Collectors.toList()));
        assertEquals("STARRED", columns.get(2).getGmailLabelId());
        assertFalse(columns.get(3).hasGmailLabel());
    }

    @Test
    void listColumns_ForExistingUser_ShouldNotSeed() {
        when(kanbanColumnRepository.findByUserIdOrderByDisplayOrderAsc("u1")).thenReturn(List.of(column("inbox", 0)));

        assertEquals(1, kanbanColumnService.listColumns("u1").size());
        verify(kanbanColumnRepository, never()).saveAll(anyList());
    }

    @Test
    void createColumn_WithoutId_ShouldGenerateIdAndAppendAtEnd() {
        // Given
        when(kanbanColumnRepository.existsByUserIdAndColumnId(eq("u1"), anyString())).thenReturn(false);
        when(kanbanColumnRepository.findByUserIdOrderByDisplayOrderAsc("u1"))
            .thenReturn(List.of(column("inbox", 0), column("todo", 4)));
        when(kanbanColumnRepository.save(any(KanbanColumn.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        KanbanColumn created = kanbanColumnService.createColumn("u1", null, "Waiting", "Label_7", null);

        // Then
        assertTrue(created.getColumnId().startsWith("col-"));
        assertEquals(5, created.getDisplayOrder());
        assertEquals("Label_7", created.getGmailLabelId());
        assertTrue(created.getRemoveLabelIds().isEmpty());
    }

    @Test
    void createColumn_WithDuplicateId_ShouldBeRejected() {
        when(kanbanColumnRepository.existsByUserIdAndColumnId("u1", "todo")).thenReturn(true);

        assertThrows(IllegalArgumentException.class,
            () -> kanbanColumnService.createColumn("u1", "todo", "To Do", null, null));
        verify(kanbanColumnRepository, never()).save(any());
    }

    @Test
    void updateColumn_Unknown_ShouldThrowColumnNotFound() {
        when(kanbanColumnRepository.findByUserIdAndColumnId("u1", "nope")).thenReturn(Optional.empty());

        assertThrows(ColumnNotFoundException.class,
            () -> kanbanColumnService.updateColumn("u1", "nope", "Name", null, null));
    }

    @Test
    void deleteColumn_ShouldMoveEmailsToInboxThenDelete() {
        // Given
        when(kanbanColumnRepository.existsByUserIdAndColumnId("u1", "waiting")).thenReturn(true);
        when(columnAssignmentService.reassignColumn("u1", "waiting", "inbox")).thenReturn(2);

        // When
        int moved = kanbanColumnService.deleteColumn("u1", "waiting");

        // Then
        assertEquals(2, moved);
        verify(kanbanColumnRepository).deleteColumn("u1", "waiting");
    }

    @Test
    void deleteColumn_BuiltIn_ShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> kanbanColumnService.deleteColumn("u1", "inbox"));
        assertThrows(IllegalArgumentException.class, () -> kanbanColumnService.deleteColumn("u1", "snoozed"));
        verifyNoInteractions(columnAssignmentService);
    }

    @Test
    void deleteColumn_Unknown_ShouldThrowColumnNotFound() {
        when(kanbanColumnRepository.existsByUserIdAndColumnId("u1", "ghost")).thenReturn(false);

        assertThrows(ColumnNotFoundException.class, () -> kanbanColumnService.deleteColumn("u1", "ghost"));
        verifyNoInteractions(columnAssignmentService);
    }
}
