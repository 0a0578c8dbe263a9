package io.github.barebone.llm.gateway.providers.stream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects one tool call while it streams in. The id and name may arrive after
 * the first argument fragments; fragments received before the call is started
 * are held back until it is.
 */
public class ToolCallAccumulator {

    private final int index;
    private String id;
    private String name;
    private final StringBuilder arguments = new StringBuilder();
    private final List<String> heldFragments = new ArrayList<>();
    private String finalArguments;
    private boolean started;
    private boolean completed;

    public ToolCallAccumulator(int index) {
        this.index = index;
    }

    public ToolCallAccumulator(int index, String id, String name) {
        this(index);
        this.id = id;
        this.name = name;
    }

    /**
     * Position of the call within the turn
     */
    public int getIndex() {
        return index;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean canStart() {
        return id != null && name != null;
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Appends a raw argument fragment. Returns true if it can be emitted now,
     * false if it was held back because the call has not started.
     */
    public boolean append(String fragment) {
        arguments.append(fragment);
        if (started) {
            return true;
        }
        heldFragments.add(fragment);
        return false;
    }

    /**
     * Marks the call started and returns the fragments held back until now.
     */
    public List<String> start() {
        started = true;
        List<String> held = new ArrayList<>(heldFragments);
        heldFragments.clear();
        return Collections.unmodifiableList(held);
    }

    void markCompleted() {
        completed = true;
    }

    /**
     * Replaces the accumulated arguments with the complete value some backends send at the end.
     */
    public void setFinalArguments(String finalArguments) {
        this.finalArguments = finalArguments;
    }

    /**
     * The complete arguments JSON: the final value when one was sent, else the concatenated fragments.
     */
    public String getArgumentsJson() {
        return finalArguments != null ? finalArguments : arguments.toString();
    }
}
