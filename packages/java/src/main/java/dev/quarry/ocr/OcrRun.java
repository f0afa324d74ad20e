package dev.quarry.ocr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transitions recorded while OCR ran over one document, per page.
 */
public final class OcrRun {
    private final Map<Integer, List<OcrState>> transitions = new LinkedHashMap<>();

    void record(int pageNumber, OcrState state) {
        transitions.computeIfAbsent(pageNumber, key -> new ArrayList<>()).add(state);
    }

    /**
     * States a page went through, in order.
     *
     * @param pageNumber 1-indexed page
     * @return transitions, empty if the page was never considered
     */
    public List<OcrState> transitions(int pageNumber) {
        List<OcrState> states = transitions.get(pageNumber);
        return states != null ? Collections.unmodifiableList(states) : List.of();
    }

    /**
     * Final state of a page.
     *
     * @param pageNumber 1-indexed page
     * @return last recorded state, or {@code NotNeeded} if none
     */
    public OcrState finalState(int pageNumber) {
        List<OcrState> states = transitions.get(pageNumber);
        return states == null || states.isEmpty() ? OcrState.notNeeded() : states.get(states.size() - 1);
    }

    public List<Integer> pages() {
        return List.copyOf(transitions.keySet());
    }

    public boolean anyRequired() {
        for (List<OcrState> states : transitions.values()) {
            if (!states.isEmpty() && states.get(0).isRequired()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "OcrRun" + transitions;
    }
}
