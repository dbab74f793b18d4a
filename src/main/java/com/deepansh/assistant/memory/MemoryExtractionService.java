package com.deepansh.assistant.memory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Captures memorable fragments after a turn, off the request thread.
 *
 * All failures are caught and logged. This is best-effort background work:
 * a turn's reply never waits on it and never fails because of it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MemoryExtractionService {

    private final MemoryManager memoryManager;
    private final MemoryClassifier memoryClassifier;

    @Async("memoryTaskExecutor")
    public void extractAndStore(String userMessage, String assistantResponse) {
        if (userMessage == null || userMessage.isBlank()) {
            return;
        }
        try {
            Map<String, List<String>> fragments = memoryClassifier.classify(userMessage);
            if (fragments.isEmpty()) {
                log.debug("Nothing memorable in user message");
                return;
            }
            List<MemoryItem> saved = memoryManager.extractAndSave(userMessage, assistantResponse, fragments);
            log.info("Captured {} memories from user message", saved.size());
        } catch (Exception e) {
            log.error("Memory extraction failed: {}", e.getMessage());
        }
    }
}
