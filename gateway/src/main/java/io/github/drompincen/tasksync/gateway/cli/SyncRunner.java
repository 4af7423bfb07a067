package io.github.drompincen.tasksync.gateway.cli;

import io.github.drompincen.tasksync.gateway.config.SyncProperties;
import io.github.drompincen.tasksync.gateway.report.SyncReportWriter;
import io.github.drompincen.tasksync.persistence.document.TasksFileDocument;
import io.github.drompincen.tasksync.persistence.markdown.TasksMarkdownParser;
import io.github.drompincen.tasksync.persistence.markdown.TasksMarkdownWriter;
import io.github.drompincen.tasksync.protocol.api.RepositoryRef;
import io.github.drompincen.tasksync.runtime.board.BoardClientException;
import io.github.drompincen.tasksync.runtime.sync.SyncResult;
import io.github.drompincen.tasksync.runtime.sync.SyncScope;
import io.github.drompincen.tasksync.runtime.sync.SyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point: validate options, parse the tasks file, sync, then write back ids,
 * prune finished tasks and emit the JSON report as requested. Exits 1 when the run recorded
 * errors or could not start.
 */
@Component
public class SyncRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(SyncRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final SyncProperties properties;
    private final Environment environment;
    private final TasksMarkdownParser parser;
    private final TasksMarkdownWriter writer;
    private final SyncService syncService;
    private final SyncReportWriter reportWriter;

    private int exitCode = EXIT_OK;

    public SyncRunner(SyncProperties properties, Environment environment, TasksMarkdownParser parser,
                      TasksMarkdownWriter writer, SyncService syncService, SyncReportWriter reportWriter) {
        this.properties = properties;
        this.environment = environment;
        this.parser = parser;
        this.writer = writer;
        this.syncService = syncService;
        this.reportWriter = reportWriter;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getNonOptionArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(List<String> positional) {
        // ---- options ----
        String tasksFile = !positional.isEmpty() ? positional.get(0) : properties.getTasksFile();
        if (tasksFile == null || tasksFile.isBlank()) {
            log.error("No tasks file given. Usage: tasksync <TASKS.md> --tasksync.org=<org> --tasksync.project-number=<n>");
            return EXIT_FAILURE;
        }
        Path path = Path.of(tasksFile);
        if (!Files.isRegularFile(path)) {
            log.error("Tasks file not found: {}", path);
            return EXIT_FAILURE;
        }
        if (properties.resolveToken(environment::getProperty) == null) {
            log.error("No GitHub token. Set tasksync.token, GITHUB_TOKEN or TASKSMD_GITHUB_TOKEN");
            return EXIT_FAILURE;
        }
        if (properties.getOrg() == null || properties.getOrg().isBlank() || properties.getProjectNumber() <= 0) {
            log.error("Both tasksync.org and a positive tasksync.project-number are required");
            return EXIT_FAILURE;
        }
        SyncScope scope;
        try {
            scope = scope();
        } catch (IllegalArgumentException e) {
            log.error("Invalid tasksync.repo: {}", e.getMessage());
            return EXIT_FAILURE;
        }
        boolean dryRun = properties.isDryRun();

        // ---- parse ----
        TasksFileDocument document;
        try {
            document = parser.load(path);
        } catch (IOException e) {
            log.error("Cannot read {}: {}", path, e.getMessage());
            return EXIT_FAILURE;
        }
        log.info("Parsed {} task(s) from {} ({} without a board id)",
                document.getTasks().size(), path, document.unlinkedTasks().size());
        document.byStatus().forEach((status, tasks) -> log.debug("  {}: {}", status, tasks.size()));

        // ---- sync ----
        SyncResult result;
        try {
            result = syncService.sync(document, scope, dryRun);
        } catch (BoardClientException e) {
            log.error("Cannot read the project board: {}", e.getMessage());
            return EXIT_FAILURE;
        }

        boolean fileFailed = false;
        Map<String, String> ids = result.allIds();
        if (properties.isWriteback() && !ids.isEmpty()) {
            if (dryRun) {
                log.info("[DRY RUN] Would write {} board id(s) back to {}", ids.size(), path);
            } else {
                try {
                    if (writer.writeBackIds(path, ids)) {
                        log.info("Wrote board ids back to {}", path);
                    } else {
                        log.info("Board ids in {} already up to date", path);
                    }
                } catch (IOException e) {
                    log.error("Writeback to {} failed: {}", path, e.getMessage());
                    fileFailed = true;
                }
            }
        }
        if (properties.isPruneDone()) {
            if (dryRun) {
                log.info("[DRY RUN] Would remove Done tasks from {}", path);
            } else {
                try {
                    if (writer.removeDoneTasks(path)) {
                        log.info("Removed Done tasks from {}", path);
                    }
                } catch (IOException e) {
                    log.error("Removing Done tasks from {} failed: {}", path, e.getMessage());
                    fileFailed = true;
                }
            }
        }

        // ---- report ----
        log.info("{}Sync complete: {}", dryRun ? "[DRY RUN] " : "", result.summary());
        for (String warning : result.getWarnings()) {
            log.debug("warning: {}", warning);
        }
        for (String error : result.getErrors()) {
            log.error("  {}", error);
        }
        if (properties.getOutputJson() != null && !properties.getOutputJson().isBlank()) {
            try {
                reportWriter.write(Path.of(properties.getOutputJson()), result.toReport());
            } catch (IOException e) {
                log.error("Cannot write report to {}: {}", properties.getOutputJson(), e.getMessage());
                fileFailed = true;
            }
        }
        return result.hasErrors() || fileFailed ? EXIT_FAILURE : EXIT_OK;
    }

    private SyncScope scope() {
        String repo = properties.getRepo();
        if (repo != null && !repo.isBlank()) {
            return new SyncScope(RepositoryRef.parse(repo), properties.getRepoLabel());
        }
        return new SyncScope(null, properties.getRepoLabel());
    }
}
