package kanban.email.app.service;

import kanban.email.app.model.MailSummary;

/**
 * Downstream consumer of newly arrived messages, e.g. a search index.
 * Optional: without a bean of this type indexing is disabled.
 */
public interface EmailIndexer {
    void index(String userId, MailSummary message) throws Exception;
}
