package com.asl.search.completion;

/**
 * Free-form text generation. Callers must treat the output as untrusted input.
 */
public interface TextCompletion {
    String complete(String prompt, CompletionOptions options);
}
