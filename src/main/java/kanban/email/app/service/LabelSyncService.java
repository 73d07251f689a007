package kanban.email.app.service;

import kanban.email.app.entity.GmailAccount;
import kanban.email.app.entity.KanbanColumn;
import kanban.email.app.model.LabelChange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Mirrors board moves onto Gmail labels.
 */
@Slf4j
@Service
public class LabelSyncService {
    static final String INBOX_LABEL = "INBOX";

    private final KanbanColumnService kanbanColumnService;
    private final GmailAccountService gmailAccountService;
    private final GmailApiService gmailApiService;

    public LabelSyncService(KanbanColumnService kanbanColumnService,
                            GmailAccountService gmailAccountService,
                            GmailApiService gmailApiService) {
        this.kanbanColumnService = kanbanColumnService;
        this.gmailAccountService = gmailAccountService;
        this.gmailApiService = gmailApiService;
    }

    /**
     * Labels to add and remove when an email moves from {@code source} to {@code target}.
     * <p>
     * The target label (or INBOX when the target has none) is added; the target's
     * remove list and the source label are removed. A label is never both added and removed.
     *
     * @param source column the email leaves, may be null
     * @param target column the email enters, may be null when it has no definition
     */
    public static LabelChange computeLabelChange(KanbanColumn source, KanbanColumn target) {
        Set<String> add = new LinkedHashSet<>();
        Set<String> remove = new LinkedHashSet<>();

        if (target != null && target.hasGmailLabel()) {
            add.add(target.getGmailLabelId());
        } else {
            add.add(INBOX_LABEL);
        }
        if (target != null && target.getRemoveLabelIds() != null) {
            remove.addAll(target.getRemoveLabelIds());
        }
        if (source != null && source.hasGmailLabel()
            && (target == null || !source.getGmailLabelId().equals(target.getGmailLabelId()))) {
            remove.add(source.getGmailLabelId());
        }
        remove.removeAll(add);
        return new LabelChange(new ArrayList<>(add), new ArrayList<>(remove));
    }

    /**
     * Applies the label change for a move on the user's primary Gmail account.
     *
     * @return false when the user has no Gmail account and nothing was sent
     */
    public boolean applyForMove(String userId, String emailId, String sourceColumnId, String targetColumnId) throws IOException {
        KanbanColumn target = kanbanColumnService.findColumn(userId, targetColumnId).orElse(null);
        KanbanColumn source = targetColumnId.equals(sourceColumnId)
            ? null
            : kanbanColumnService.findColumn(userId, sourceColumnId).orElse(null);
        return apply(userId, emailId, computeLabelChange(source, target));
    }

    /**
     * Applies only the target column's own label policy. Columns without one leave Gmail untouched.
     */
    public boolean applyColumnPolicy(String userId, String emailId, String targetColumnId) throws IOException {
        Optional<KanbanColumn> target = kanbanColumnService.findColumn(userId, targetColumnId);
        if (target.isEmpty() || !hasPolicy(target.get())) {
            return false;
        }
        return apply(userId, emailId, computeLabelChange(null, target.get()));
    }

    private boolean apply(String userId, String emailId, LabelChange change) throws IOException {
        if (change.isEmpty()) {
            return false;
        }
        Optional<GmailAccount> account = gmailAccountService.findPrimaryAccount(userId);
        if (account.isEmpty()) {
            log.debug("User {} has no Gmail account, skipping label sync for {}", userId, emailId);
            return false;
        }
        GmailAccount gmailAccount = account.get();
        gmailAccountService.callWithAccessToken(gmailAccount, accessToken -> {
            gmailApiService.modifyLabels(accessToken, gmailAccount.getEmailAddress(), emailId,
                change.getAddLabelIds(), change.getRemoveLabelIds());
            return null;
        });
        log.info("Synced labels for email {} of user {}: +{} -{}", emailId, userId,
            change.getAddLabelIds(), change.getRemoveLabelIds());
        return true;
    }

    private static boolean hasPolicy(KanbanColumn column) {
        return column.hasGmailLabel() || (column.getRemoveLabelIds() != null && !column.getRemoveLabelIds().isEmpty());
    }
}
