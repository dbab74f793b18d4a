package com.deepansh.assistant.memory;

import java.util.List;
import java.util.Map;

/**
 * Sorts fragments of a user utterance into memory kinds.
 * Output is advisory: false negatives are expected and harmless.
 */
public interface MemoryClassifier {

    /**
     * @return fragments keyed by memory kind tag (e.g. "user_preference");
     *         empty when nothing looks memorable
     */
    Map<String, List<String>> classify(String userMessage);
}
