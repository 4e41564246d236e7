package com.example.courserag.ai;

import com.example.courserag.ai.dto.CompletionRequest;
import com.example.courserag.ai.dto.CompletionResponse;

/**
 * Blocking access to the language-model completion service. Transport failures
 * (timeouts, auth, network) surface as unchecked exceptions.
 */
public interface CompletionClient {

    CompletionResponse complete(CompletionRequest request);
}
