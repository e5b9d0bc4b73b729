package org.javai.resilience;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A serialisable view of a throwable and its cause chain, used in verbose renderings.
 *
 * @param name The exception class name
 * @param message The exception message (may be null)
 * @param stack The stack frames, outermost first
 * @param cause The next link of the chain (may be null)
 */
public record CauseTrace(String name, String message, List<String> stack, CauseTrace cause) {

    static final int MAX_DEPTH = 16;

    public CauseTrace {
        Objects.requireNonNull(name, "name must not be null");
        stack = stack == null ? List.of() : List.copyOf(stack);
    }

    public static CauseTrace fromThrowable(Throwable t) {
        Objects.requireNonNull(t, "throwable must not be null");
        return build(t, Collections.newSetFromMap(new IdentityHashMap<>()), 0);
    }

    private static CauseTrace build(Throwable t, Set<Throwable> seen, int depth) {
        seen.add(t);
        Throwable next = t.getCause();
        CauseTrace nested = null;
        if (next != null && depth + 1 < MAX_DEPTH && !seen.contains(next)) {
            nested = build(next, seen, depth + 1);
        }
        return new CauseTrace(t.getClass().getName(), t.getMessage(), framesOf(t), nested);
    }

    static List<String> framesOf(Throwable t) {
        StackTraceElement[] elements = t.getStackTrace();
        List<String> frames = new ArrayList<>(elements.length);
        for (StackTraceElement element : elements) {
            frames.add(element.toString());
        }
        return frames;
    }

    /**
     * Number of links in this chain, including this one.
     */
    public int depth() {
        return cause == null ? 1 : 1 + cause.depth();
    }

    /**
     * Renders this chain as nested maps with keys {@code name, message, stack, cause}.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("message", message);
        map.put("stack", stack);
        if (cause != null) {
            map.put("cause", cause.toMap());
        }
        return map;
    }
}
