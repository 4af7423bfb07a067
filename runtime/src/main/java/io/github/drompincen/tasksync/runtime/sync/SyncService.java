package io.github.drompincen.tasksync.runtime.sync;

import io.github.drompincen.tasksync.persistence.document.TasksFileDocument;
import io.github.drompincen.tasksync.protocol.api.BoardItemDto;
import io.github.drompincen.tasksync.runtime.board.BoardClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * One full reconciliation: list the board, plan, execute. A failed listing is not caught
 * here; nothing is planned or mutated when the board state is unknown.
 */
@Service
public class SyncService {

    private static final Logger log = LoggerFactory.getLogger(SyncService.class);

    private final BoardClient client;
    private final SyncPlanner planner;
    private final SyncExecutor executor;

    public SyncService(BoardClient client, SyncPlanner planner, SyncExecutor executor) {
        this.client = client;
        this.planner = planner;
        this.executor = executor;
    }

    public SyncResult sync(TasksFileDocument file, SyncScope scope, boolean dryRun) {
        log.info("[Sync] {} task(s) from {}, scope: {}", file.getTasks().size(), file.getSourcePath(), scope);
        if (scope.isUnscoped()) {
            log.warn("[Sync] No repository or label scope; every unmatched item on the board will be archived");
        }

        List<BoardItemDto> items = client.listItems();
        log.info("[Sync] Found {} item(s) on the board", items.size());

        SyncPlan plan = planner.plan(file.getTasks(), items, scope);
        log.info("[Sync] Plan: {}", plan.summary());
        return executor.execute(plan, scope, dryRun);
    }
}
