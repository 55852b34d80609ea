package com.tsl.search.completion;

public interface CompletionProvider {
    String complete(String prompt, Integer timeoutMs);
}
