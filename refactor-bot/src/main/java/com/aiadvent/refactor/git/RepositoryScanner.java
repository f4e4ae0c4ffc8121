package com.aiadvent.refactor.git;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

@Component
public class RepositoryScanner {

  private final GitClient git;

  public RepositoryScanner(GitClient git) {
    this.git = Objects.requireNonNull(git, "git");
  }

  public RepositorySummary scan() {
    List<String> files = GitClient.lines(git.run("ls-files"));
    TreeSet<String> topLevel = new TreeSet<>();
    for (String file : files) {
      int slash = file.indexOf('/');
      if (slash > 0) {
        topLevel.add(file.substring(0, slash));
      }
    }
    return new RepositorySummary(files.size(), List.copyOf(topLevel));
  }

  public record RepositorySummary(int trackedFileCount, List<String> topLevelDirectories) {}
}
