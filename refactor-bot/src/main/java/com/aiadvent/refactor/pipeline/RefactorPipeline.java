package com.aiadvent.refactor.pipeline;

import com.aiadvent.refactor.config.RefactorBotProperties;
import com.aiadvent.refactor.generation.ChunkGenerationReport;
import com.aiadvent.refactor.generation.GenerationPort;
import com.aiadvent.refactor.generation.PatchGenerationService;
import com.aiadvent.refactor.generation.RepairRequest;
import com.aiadvent.refactor.generation.UsageStats;
import com.aiadvent.refactor.git.CommitRange;
import com.aiadvent.refactor.git.CommitRangeResolver;
import com.aiadvent.refactor.git.DiffContext;
import com.aiadvent.refactor.git.GitApplyEngine;
import com.aiadvent.refactor.git.GitBranchManager;
import com.aiadvent.refactor.git.GitDiffExtractor;
import com.aiadvent.refactor.git.RepositoryScanner;
import com.aiadvent.refactor.git.StagedFileStat;
import com.aiadvent.refactor.patch.BehaviorGuardMode;
import com.aiadvent.refactor.patch.CandidateOutcome;
import com.aiadvent.refactor.patch.ChunkPrioritizer;
import com.aiadvent.refactor.patch.DiffChunk;
import com.aiadvent.refactor.patch.PatchApplyStateMachine;
import com.aiadvent.refactor.patch.PatchCandidate;
import com.aiadvent.refactor.patch.PatchLifecycleStats;
import com.aiadvent.refactor.patch.PatchRepairer;
import com.aiadvent.refactor.process.CommandExecutionException;
import com.aiadvent.refactor.process.CommandExecutor;
import com.aiadvent.refactor.process.CommandResult;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * One end-to-end run: range, chunks, generation, apply with repair, tests, then publication. Every
 * early exit maps to a {@link RunOutcome.SkipReason}; nothing is pushed unless all checks pass.
 */
@Service
public class RefactorPipeline {

  private static final Logger log = LoggerFactory.getLogger(RefactorPipeline.class);
  private static final DateTimeFormatter BRANCH_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

  private final RefactorBotProperties properties;
  private final CommitRangeResolver rangeResolver;
  private final GitDiffExtractor diffExtractor;
  private final RepositoryScanner repositoryScanner;
  private final PatchGenerationService generationService;
  private final GenerationPort generationPort;
  private final PatchApplyStateMachine applyStateMachine;
  private final GitApplyEngine applyEngine;
  private final GitBranchManager branchManager;
  private final CommandExecutor commandExecutor;
  private final PullRequestCreator pullRequestCreator;
  private final Clock clock;

  public RefactorPipeline(
      RefactorBotProperties properties,
      CommitRangeResolver rangeResolver,
      GitDiffExtractor diffExtractor,
      RepositoryScanner repositoryScanner,
      PatchGenerationService generationService,
      GenerationPort generationPort,
      PatchApplyStateMachine applyStateMachine,
      GitApplyEngine applyEngine,
      GitBranchManager branchManager,
      CommandExecutor commandExecutor,
      PullRequestCreator pullRequestCreator,
      Clock clock) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.rangeResolver = Objects.requireNonNull(rangeResolver, "rangeResolver");
    this.diffExtractor = Objects.requireNonNull(diffExtractor, "diffExtractor");
    this.repositoryScanner = Objects.requireNonNull(repositoryScanner, "repositoryScanner");
    this.generationService = Objects.requireNonNull(generationService, "generationService");
    this.generationPort = Objects.requireNonNull(generationPort, "generationPort");
    this.applyStateMachine = Objects.requireNonNull(applyStateMachine, "applyStateMachine");
    this.applyEngine = Objects.requireNonNull(applyEngine, "applyEngine");
    this.branchManager = Objects.requireNonNull(branchManager, "branchManager");
    this.commandExecutor = Objects.requireNonNull(commandExecutor, "commandExecutor");
    this.pullRequestCreator = Objects.requireNonNull(pullRequestCreator, "pullRequestCreator");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public RunResult run(Path eventPath, UsageStats usage) {
    Objects.requireNonNull(usage, "usage");
    PatchLifecycleStats stats = new PatchLifecycleStats();
    CommitRange range = rangeResolver.resolve(eventPath);

    DiffContext context = diffExtractor.extract(range);
    if (context == null) {
      return new RunResult(range, RunOutcome.skipped(RunOutcome.SkipReason.NO_DIFF, null), stats);
    }
    if (!context.excludedFiles().isEmpty()) {
      log.info("Excluded files: {}", context.excludedFiles());
    }
    if (log.isDebugEnabled()) {
      RepositoryScanner.RepositorySummary summary = repositoryScanner.scan();
      log.debug(
          "Repository scan: trackedFiles={}, topLevel={}",
          summary.trackedFileCount(),
          summary.topLevelDirectories());
    }

    BehaviorGuardMode guardMode = properties.getResolvedGuardMode();
    List<DiffChunk> prioritized = ChunkPrioritizer.prioritize(context.chunks(), guardMode);
    List<DiffChunk> selected =
        prioritized.subList(0, Math.min(prioritized.size(), properties.getMaxChunksPerRun()));
    log.info(
        "Chunks selected: selected={}, total={}, guardMode={}",
        selected.size(),
        prioritized.size(),
        guardMode.code());

    ChunkGenerationReport report =
        generationService.generate(
            properties.getRepository(),
            range.baseSha(),
            range.headSha(),
            selected,
            usage,
            stats);
    if (report.candidates().isEmpty()) {
      if (report.failedChunks() > 0) {
        return new RunResult(
            range,
            RunOutcome.modelFailure(
                report.breakdown().subtype(), report.failedChunks(), report.totalChunks()),
            stats);
      }
      return new RunResult(
          range, RunOutcome.skipped(RunOutcome.SkipReason.NO_PATCH, "no patch generated"), stats);
    }

    PatchRepairer repairer =
        (chunk, failedPatch, applyError) ->
            generationPort.repair(
                new RepairRequest(
                    properties.getRepository(),
                    range.baseSha(),
                    range.headSha(),
                    chunk,
                    failedPatch,
                    applyError,
                    usage));
    for (PatchCandidate candidate : report.candidates()) {
      CandidateOutcome outcome = applyStateMachine.drive(candidate, repairer, stats);
      log.info(
          "Patch candidate finished: files={}, status={}, detail={}",
          candidate.chunk().files(),
          outcome.status(),
          outcome.detail());
      if (outcome.isHardFailure()) {
        return new RunResult(
            range,
            RunOutcome.skipped(RunOutcome.SkipReason.PATCH_APPLY_FAILURE, outcome.detail()),
            stats);
      }
    }
    if (stats.applied() == 0) {
      return new RunResult(
          range, RunOutcome.skipped(RunOutcome.SkipReason.NO_PATCH, "no patch applied"), stats);
    }
    if (!applyEngine.hasStagedChanges()) {
      return new RunResult(
          range,
          RunOutcome.skipped(
              RunOutcome.SkipReason.NO_PATCH, "applied patches left no staged changes"),
          stats);
    }

    String testFailure = runTests();
    if (testFailure != null) {
      return new RunResult(
          range, RunOutcome.skipped(RunOutcome.SkipReason.TEST_FAILURE, testFailure), stats);
    }

    return new RunResult(range, publish(range, context, selected.size(), stats, usage), stats);
  }

  /** @return {@code null} when the test command passed, otherwise its diagnostics */
  private String runTests() {
    String testCommand = properties.getTestCommand();
    if (!StringUtils.hasText(testCommand)) {
      return "No test command configured";
    }
    List<String> command = Arrays.asList(testCommand.trim().split("\\s+"));
    log.info("Running test command: {}", testCommand);
    try {
      CommandResult result =
          commandExecutor.run(command, workdir(), properties.getCommandTimeout());
      if (result.succeeded()) {
        return null;
      }
      log.warn("Test command failed: exitCode={}", result.exitCode());
      return "Test command failed with exit code "
          + result.exitCode()
          + ": "
          + tail(result.diagnostics());
    } catch (CommandExecutionException ex) {
      log.warn("Test command did not complete: {}", ex.getMessage());
      return ex.getMessage();
    }
  }

  private RunOutcome publish(
      CommitRange range,
      DiffContext context,
      int selectedChunks,
      PatchLifecycleStats stats,
      UsageStats usage) {
    List<String> files = applyEngine.listStagedFiles();
    String changeSummary;
    try {
      changeSummary = applyEngine.stagedShortStat();
    } catch (CommandExecutionException ex) {
      log.warn("Failed to compute staged shortstat: {}", ex.getMessage());
      changeSummary = "";
    }
    if (!StringUtils.hasText(changeSummary)) {
      changeSummary = "staged changes";
    }
    List<StagedFileStat> fileStats = applyEngine.stagedNumstat();

    String branchName =
        properties.getBranchPrefix()
            + "-"
            + LocalDateTime.now(clock).format(BRANCH_TIMESTAMP);
    branchManager.configureIdentity(
        properties.getGit().getAuthorName(), properties.getGit().getAuthorEmail());
    branchManager.createBranch(branchName);
    branchManager.commitStaged(properties.getCommitMessage());
    branchManager.push(branchName);

    String body =
        PullRequestBodyBuilder.build(
            new PullRequestBodyBuilder.Input(
                range,
                context.chunks().size(),
                selectedChunks,
                stats,
                fileStats,
                changeSummary,
                usage.snapshot(),
                properties.getResolvedGuardMode(),
                properties.getTestCommand()));
    PullRequestRef pullRequest =
        pullRequestCreator.create(
            properties.getOwner(),
            properties.getRepositoryName(),
            properties.getPullRequestTitle(),
            body,
            branchName,
            properties.getBaseBranch());
    log.info(
        "Pull request created: url={}, branch={}, files={}",
        pullRequest.url(),
        branchName,
        files.size());
    return RunOutcome.created(branchName, pullRequest.url(), files, changeSummary);
  }

  private Path workdir() {
    return properties.getWorkdir().toAbsolutePath().normalize();
  }

  private static String tail(String output) {
    if (output == null) {
      return "";
    }
    String[] lines = output.split("\\R");
    int from = Math.max(0, lines.length - 20);
    return String.join("\n", Arrays.copyOfRange(lines, from, lines.length));
  }
}
