package inbox.triage.app.service;

import inbox.triage.app.entity.SenderHistoryEntry;
import inbox.triage.app.repository.SenderHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Namespaced per-sender history. Only listing and clearing are exposed; the triage pipeline
 * neither reads nor writes it.
 */
@Slf4j
@Service
public class SenderHistoryService {
    private final SenderHistoryRepository senderHistoryRepository;

    public SenderHistoryService(SenderHistoryRepository senderHistoryRepository) {
        this.senderHistoryRepository = senderHistoryRepository;
    }

    @Transactional(readOnly = true)
    public List<SenderHistoryEntry> list(String namespace) {
        return senderHistoryRepository.findByNamespaceOrderByKeyAsc(requireNamespace(namespace));
    }

    @Transactional
    public long clear(String namespace) {
        long removed = senderHistoryRepository.deleteByNamespace(requireNamespace(namespace));
        log.info("Cleared {} sender history entries from namespace {}", removed, namespace);
        return removed;
    }

    private static String requireNamespace(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("Namespace is required");
        }
        return namespace.trim();
    }
}
