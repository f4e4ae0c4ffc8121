package com.aiadvent.refactor.git;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/** The subset of a push webhook payload the bot reads (and writes, in watch mode). */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PushEventPayload(String before, String after, String ref) {}
