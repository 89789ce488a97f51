package com.architecture.memory.graphdiff.service.diff;

import com.architecture.memory.graphdiff.config.GraphDiffProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Set of type transitions ({@code from->to}) that the conflict detector reports.
 * Seeded from {@code graph-diff.forbidden-type-transitions}; callers may extend it at runtime.
 */
@Component
@Slf4j
public class TypeTransitionPolicy {

    private static final String ARROW = "->";

    private final Set<String> forbidden = ConcurrentHashMap.newKeySet();

    public TypeTransitionPolicy(GraphDiffProperties properties) {
        for (String transition : properties.getForbiddenTypeTransitions()) {
            int arrow = transition.indexOf(ARROW);
            if (arrow <= 0 || arrow + ARROW.length() >= transition.length()) {
                throw new IllegalArgumentException("Invalid type transition '" + transition
                        + "', expected from->to");
            }
            forbid(transition.substring(0, arrow).trim(), transition.substring(arrow + ARROW.length()).trim());
        }
        log.info("Type transition policy initialized with {} forbidden transitions", forbidden.size());
    }

    public boolean isForbidden(Object fromType, Object toType) {
        if (fromType == null || toType == null) {
            return false;
        }
        return forbidden.contains(key(fromType.toString(), toType.toString()));
    }

    public void forbid(String fromType, String toType) {
        forbidden.add(key(fromType, toType));
    }

    public boolean allow(String fromType, String toType) {
        return forbidden.remove(key(fromType, toType));
    }

    public List<String> getForbiddenTransitions() {
        return forbidden.stream().sorted().toList();
    }

    private static String key(String fromType, String toType) {
        return Objects.requireNonNull(fromType, "fromType") + ARROW + Objects.requireNonNull(toType, "toType");
    }
}
