package com.aiadvent.refactor.pipeline;

import com.aiadvent.refactor.config.RefactorBotProperties;
import com.aiadvent.refactor.git.GitApplyEngine;
import com.aiadvent.refactor.patch.PatchApplyStateMachine;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class PipelineConfiguration {

  @Bean
  PatchApplyStateMachine patchApplyStateMachine(
      GitApplyEngine applyEngine,
      RefactorBotProperties properties,
      ObjectProvider<MeterRegistry> meterRegistry) {
    return new PatchApplyStateMachine(
        applyEngine,
        properties.getResolvedGuardMode(),
        properties.getPatchRepairAttempts(),
        meterRegistry.getIfAvailable());
  }

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
