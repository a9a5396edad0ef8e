package inbox.triage.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "sender_history",
       uniqueConstraints = @UniqueConstraint(columnNames = {"namespace", "entry_key"}))
@Data
public class SenderHistoryEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String namespace;

    @Column(name = "entry_key", nullable = false)
    private String key;

    @Column(name = "entry_value", columnDefinition = "TEXT")
    private String value;

    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
