package app.lexis.core.sync.controller;

import app.lexis.core.sync.domain.SyncIdentity;
import app.lexis.core.sync.domain.SyncReport;
import app.lexis.core.sync.domain.SyncStatus;
import app.lexis.core.sync.service.SyncService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/sync")
public class SyncController {

    private final SyncService syncService;

    public SyncController(SyncService syncService) {
        this.syncService = syncService;
    }

    // POST /sync/activate {"syncKey": "..."}
    @PostMapping("/activate")
    public SyncReport activate(@Valid @RequestBody ActivateSyncRequest req) {
        return syncService.activate(new SyncIdentity(req.syncKey()));
    }

    // DELETE /sync
    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deactivate() {
        syncService.deactivate();
    }

    // GET /sync
    @GetMapping
    public SyncStatus status() {
        return syncService.status();
    }

    public record ActivateSyncRequest(@NotBlank String syncKey) {
    }
}
