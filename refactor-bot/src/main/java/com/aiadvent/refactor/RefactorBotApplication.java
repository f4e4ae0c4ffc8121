package com.aiadvent.refactor;

import com.aiadvent.refactor.config.GitHubBackendProperties;
import com.aiadvent.refactor.config.RefactorBotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({RefactorBotProperties.class, GitHubBackendProperties.class})
public class RefactorBotApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(RefactorBotApplication.class, args)));
  }
}
