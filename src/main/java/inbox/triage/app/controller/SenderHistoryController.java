package inbox.triage.app.controller;

import inbox.triage.app.entity.SenderHistoryEntry;
import inbox.triage.app.service.SenderHistoryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sender-history")
public class SenderHistoryController {
    private final SenderHistoryService senderHistoryService;

    public SenderHistoryController(SenderHistoryService senderHistoryService) {
        this.senderHistoryService = senderHistoryService;
    }

    @GetMapping("/{namespace}")
    public List<SenderHistoryEntry> list(@PathVariable String namespace) {
        return senderHistoryService.list(namespace);
    }

    @DeleteMapping("/{namespace}")
    public ResponseEntity<Map<String, Object>> clear(@PathVariable String namespace) {
        long removed = senderHistoryService.clear(namespace);
        return ResponseEntity.ok(Map.of("namespace", namespace, "removed", removed));
    }
}
