package com.aiadvent.refactor.config;

import com.aiadvent.refactor.patch.BehaviorGuardMode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "refactor")
public class RefactorBotProperties implements InitializingBean {

  static final String DEFAULT_EXCLUDE_PATTERNS =
      "(^|/)package-lock\\.json$,(^|/)yarn\\.lock$,(^|/)pnpm-lock\\.yaml$,"
          + "\\.min\\.js$,\\.map$,(^|/)dist/";

  private static final ObjectMapper PATTERN_READER = new ObjectMapper();

  private String repository = "owner/repo";
  private String baseBranch = "main";
  private String eventPath;
  private Path workdir = Path.of(".");
  private String testCommand = "mvn -B -ntp test";
  private Duration commandTimeout = Duration.ofMinutes(10);
  private int maxDiffSize = 80_000;
  private int maxFilesPerChunk = 1;
  private int maxChunksPerRun = 20;
  private int patchRepairAttempts = 2;
  private String behaviorGuardMode = "strict";
  private String fileExcludePatterns = DEFAULT_EXCLUDE_PATTERNS;
  private String branchPrefix = "refactor/minimax";
  private String commitMessage = "auto: minimax refactor & optimization";
  private String pullRequestTitle = "auto: minimax refactor & optimization";
  private String reportPath;
  private GenerationProperties generation = new GenerationProperties();
  private GitIdentityProperties git = new GitIdentityProperties();
  private WatchProperties watch = new WatchProperties();

  private List<Pattern> resolvedExcludePatterns = List.of();
  private BehaviorGuardMode resolvedGuardMode = BehaviorGuardMode.STRICT;

  @Override
  public void afterPropertiesSet() {
    requirePositive("max-diff-size", maxDiffSize);
    requirePositive("max-files-per-chunk", maxFilesPerChunk);
    requirePositive("max-chunks-per-run", maxChunksPerRun);
    if (patchRepairAttempts < 0) {
      throw new IllegalStateException(
          "refactor.patch-repair-attempts must be >= 0, got " + patchRepairAttempts);
    }
    if (!StringUtils.hasText(repository) || repository.trim().split("/").length != 2) {
      throw new IllegalStateException(
          "refactor.repository must use the owner/repo format, got '" + repository + "'");
    }
    if (!StringUtils.hasText(baseBranch)) {
      throw new IllegalStateException("refactor.base-branch must not be blank");
    }
    if (commandTimeout == null || commandTimeout.isNegative() || commandTimeout.isZero()) {
      throw new IllegalStateException("refactor.command-timeout must be positive");
    }
    resolvedGuardMode = BehaviorGuardMode.parse(behaviorGuardMode);
    resolvedExcludePatterns = parseExcludePatterns(fileExcludePatterns);
    generation.validate();
    watch.validate();
  }

  /**
   * Accepts a blank value or {@code none} (no exclusions), a JSON array of regular expressions, or a
   * comma separated list. In the list form commas inside {@code {}} quantifiers, {@code []} classes
   * or after a backslash stay part of the pattern. Patterns are compiled case-insensitively.
   */
  static List<Pattern> parseExcludePatterns(String raw) {
    if (!StringUtils.hasText(raw) || "none".equalsIgnoreCase(raw.trim())) {
      return List.of();
    }
    String value = raw.trim();
    List<String> sources;
    if (value.startsWith("[")) {
      try {
        sources = PATTERN_READER.readValue(value, new TypeReference<List<String>>() {});
      } catch (JsonProcessingException ex) {
        throw new IllegalStateException(
            "refactor.file-exclude-patterns is not a valid JSON array: " + ex.getOriginalMessage(),
            ex);
      }
    } else {
      sources = splitPatternList(value);
    }
    List<Pattern> patterns = new ArrayList<>();
    for (String source : sources) {
      if (!StringUtils.hasText(source)) {
        continue;
      }
      try {
        patterns.add(Pattern.compile(source.trim(), Pattern.CASE_INSENSITIVE));
      } catch (PatternSyntaxException ex) {
        throw new IllegalStateException(
            "Invalid regex in refactor.file-exclude-patterns: " + source.trim(), ex);
      }
    }
    return List.copyOf(patterns);
  }

  private static List<String> splitPatternList(String value) {
    List<String> parts = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int braces = 0;
    boolean inClass = false;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '\\' && i + 1 < value.length()) {
        current.append(c).append(value.charAt(++i));
        continue;
      }
      if (inClass) {
        inClass = c != ']';
      } else if (c == '[') {
        inClass = true;
      } else if (c == '{') {
        braces++;
      } else if (c == '}' && braces > 0) {
        braces--;
      } else if (c == ',' && braces == 0) {
        parts.add(current.toString());
        current.setLength(0);
        continue;
      }
      current.append(c);
    }
    parts.add(current.toString());
    return parts;
  }

  private static void requirePositive(String name, int value) {
    if (value <= 0) {
      throw new IllegalStateException("refactor." + name + " must be positive, got " + value);
    }
  }

  public String getOwner() {
    return repository.trim().split("/")[0];
  }

  public String getRepositoryName() {
    return repository.trim().split("/")[1];
  }

  public List<Pattern> getResolvedExcludePatterns() {
    return resolvedExcludePatterns;
  }

  public BehaviorGuardMode getResolvedGuardMode() {
    return resolvedGuardMode;
  }

  public String getRepository() {
    return repository;
  }

  public void setRepository(String repository) {
    this.repository = repository;
  }

  public String getBaseBranch() {
    return baseBranch;
  }

  public void setBaseBranch(String baseBranch) {
    this.baseBranch = baseBranch;
  }

  public String getEventPath() {
    return eventPath;
  }

  public void setEventPath(String eventPath) {
    this.eventPath = eventPath;
  }

  public Path getWorkdir() {
    return workdir;
  }

  public void setWorkdir(Path workdir) {
    this.workdir = workdir;
  }

  public String getTestCommand() {
    return testCommand;
  }

  public void setTestCommand(String testCommand) {
    this.testCommand = testCommand;
  }

  public Duration getCommandTimeout() {
    return commandTimeout;
  }

  public void setCommandTimeout(Duration commandTimeout) {
    this.commandTimeout = commandTimeout;
  }

  public int getMaxDiffSize() {
    return maxDiffSize;
  }

  public void setMaxDiffSize(int maxDiffSize) {
    this.maxDiffSize = maxDiffSize;
  }

  public int getMaxFilesPerChunk() {
    return maxFilesPerChunk;
  }

  public void setMaxFilesPerChunk(int maxFilesPerChunk) {
    this.maxFilesPerChunk = maxFilesPerChunk;
  }

  public int getMaxChunksPerRun() {
    return maxChunksPerRun;
  }

  public void setMaxChunksPerRun(int maxChunksPerRun) {
    this.maxChunksPerRun = maxChunksPerRun;
  }

  public int getPatchRepairAttempts() {
    return patchRepairAttempts;
  }

  public void setPatchRepairAttempts(int patchRepairAttempts) {
    this.patchRepairAttempts = patchRepairAttempts;
  }

  public String getBehaviorGuardMode() {
    return behaviorGuardMode;
  }

  public void setBehaviorGuardMode(String behaviorGuardMode) {
    this.behaviorGuardMode = behaviorGuardMode;
  }

  public String getFileExcludePatterns() {
    return fileExcludePatterns;
  }

  public void setFileExcludePatterns(String fileExcludePatterns) {
    this.fileExcludePatterns = fileExcludePatterns;
  }

  public String getBranchPrefix() {
    return branchPrefix;
  }

  public void setBranchPrefix(String branchPrefix) {
    this.branchPrefix = branchPrefix;
  }

  public String getCommitMessage() {
    return commitMessage;
  }

  public void setCommitMessage(String commitMessage) {
    this.commitMessage = commitMessage;
  }

  public String getPullRequestTitle() {
    return pullRequestTitle;
  }

  public void setPullRequestTitle(String pullRequestTitle) {
    this.pullRequestTitle = pullRequestTitle;
  }

  public String getReportPath() {
    return reportPath;
  }

  public Path resolveReportPath() {
    return StringUtils.hasText(reportPath) ? Path.of(reportPath.trim()) : null;
  }

  public void setReportPath(String reportPath) {
    this.reportPath = reportPath;
  }

  public GenerationProperties getGeneration() {
    return generation;
  }

  public void setGeneration(GenerationProperties generation) {
    this.generation = generation;
  }

  public GitIdentityProperties getGit() {
    return git;
  }

  public void setGit(GitIdentityProperties git) {
    this.git = git;
  }

  public WatchProperties getWatch() {
    return watch;
  }

  public void setWatch(WatchProperties watch) {
    this.watch = watch;
  }

  public static class GenerationProperties {

    private String baseUrl = "https://openrouter.ai/api/v1";
    private String apiKey;
    private String model = "minimax/minimax-m2.5";
    private double temperature = 0.1d;
    private Duration timeout = Duration.ofSeconds(60);
    private int maxRetries = 2;
    private Duration initialBackoff = Duration.ofMillis(400);
    private double backoffMultiplier = 2.0d;

    void validate() {
      if (!StringUtils.hasText(baseUrl)) {
        throw new IllegalStateException("refactor.generation.base-url must not be blank");
      }
      if (!StringUtils.hasText(model)) {
        throw new IllegalStateException("refactor.generation.model must not be blank");
      }
      if (maxRetries < 0) {
        throw new IllegalStateException("refactor.generation.max-retries must be >= 0");
      }
      if (timeout == null || timeout.isNegative() || timeout.isZero()) {
        throw new IllegalStateException("refactor.generation.timeout must be positive");
      }
      if (backoffMultiplier < 1.0d) {
        throw new IllegalStateException("refactor.generation.backoff-multiplier must be >= 1");
      }
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getModel() {
      return model;
    }

    public void setModel(String model) {
      this.model = model;
    }

    public double getTemperature() {
      return temperature;
    }

    public void setTemperature(double temperature) {
      this.temperature = temperature;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
    }

    public double getBackoffMultiplier() {
      return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
      this.backoffMultiplier = backoffMultiplier;
    }
  }

  public static class GitIdentityProperties {

    private String authorName = "minimax-refactor-bot";
    private String authorEmail = "bot@users.noreply.github.com";

    public String getAuthorName() {
      return authorName;
    }

    public void setAuthorName(String authorName) {
      this.authorName = authorName;
    }

    public String getAuthorEmail() {
      return authorEmail;
    }

    public void setAuthorEmail(String authorEmail) {
      this.authorEmail = authorEmail;
    }
  }

  public static class WatchProperties {

    private Duration pollInterval = Duration.ofSeconds(60);

    void validate() {
      if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
        throw new IllegalStateException("refactor.watch.poll-interval must be positive");
      }
    }

    public Duration getPollInterval() {
      return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
    }
  }
}
