package com.aiadvent.refactor.git;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Determines the commit range of a run from a push event payload. A missing payload, a missing SHA
 * or an all-zero {@code before} (first push of a branch) falls back to {@code HEAD~1..HEAD}.
 */
@Component
public class CommitRangeResolver {

  private static final Logger log = LoggerFactory.getLogger(CommitRangeResolver.class);
  private static final Pattern ZERO_SHA = Pattern.compile("^0+$");

  private final GitClient git;
  private final ObjectMapper objectMapper;

  public CommitRangeResolver(GitClient git, ObjectMapper objectMapper) {
    this.git = Objects.requireNonNull(git, "git");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public CommitRange resolve(Path eventPath) {
    if (eventPath != null && Files.isRegularFile(eventPath)) {
      PushEventPayload payload = read(eventPath);
      if (StringUtils.hasText(payload.before())
          && StringUtils.hasText(payload.after())
          && !ZERO_SHA.matcher(payload.before().trim()).matches()) {
        CommitRange range = new CommitRange(payload.before().trim(), payload.after().trim());
        log.info("Commit range from push event: {}", range.shortForm());
        return range;
      }
      log.info("Push event {} has no usable range, falling back to HEAD~1..HEAD", eventPath);
    } else if (eventPath != null) {
      log.warn("Push event payload {} not found, falling back to HEAD~1..HEAD", eventPath);
    }
    String head = git.revParse("HEAD");
    String base = git.revParse("HEAD~1");
    return new CommitRange(base, head);
  }

  private PushEventPayload read(Path eventPath) {
    try {
      return objectMapper.readValue(Files.readAllBytes(eventPath), PushEventPayload.class);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to read push event payload " + eventPath, ex);
    }
  }
}
