package com.deepansh.assistant.memory;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Classifies sentences by trigger phrases: a sentence containing one of a
 * kind's phrases is kept whole under that kind. A sentence may land under
 * several kinds.
 */
@Component
public class TriggerPhraseMemoryClassifier implements MemoryClassifier {

    private static final Pattern SENTENCE_END = Pattern.compile("[。！？!?\\n]");

    private static final Map<MemoryType, List<Pattern>> TRIGGERS = new LinkedHashMap<>();

    static {
        TRIGGERS.put(MemoryType.USER_PREFERENCE, List.of(Pattern.compile("喜欢"), Pattern.compile("偏好")));
        TRIGGERS.put(MemoryType.USER_INFO,
                List.of(Pattern.compile("我是"), Pattern.compile("我叫"), Pattern.compile("我的名字")));
        TRIGGERS.put(MemoryType.TOPIC_INTEREST, List.of(Pattern.compile("对.+感兴趣")));
    }

    @Override
    public Map<String, List<String>> classify(String userMessage) {
        Map<String, List<String>> classified = new LinkedHashMap<>();
        if (userMessage == null || userMessage.isBlank()) {
            return classified;
        }
        for (String raw : SENTENCE_END.split(userMessage)) {
            String sentence = raw.trim();
            if (sentence.isEmpty()) {
                continue;
            }
            TRIGGERS.forEach((type, patterns) -> {
                if (patterns.stream().anyMatch(p -> p.matcher(sentence).find())) {
                    classified.computeIfAbsent(type.value(), k -> new ArrayList<>()).add(sentence);
                }
            });
        }
        return classified;
    }
}
