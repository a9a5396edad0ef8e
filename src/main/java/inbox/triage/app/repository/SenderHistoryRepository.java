package inbox.triage.app.repository;

import inbox.triage.app.entity.SenderHistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SenderHistoryRepository extends JpaRepository<SenderHistoryEntry, String> {
    List<SenderHistoryEntry> findByNamespaceOrderByKeyAsc(String namespace);
    long deleteByNamespace(String namespace);
}
