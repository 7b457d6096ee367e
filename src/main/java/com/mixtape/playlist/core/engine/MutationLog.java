package com.mixtape.playlist.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Bounded undo/redo history of the structural changes of one playlist.
 * <p>
 * Only {@link #execute(MutationCommand)} adds commands. When the capacity is exceeded the oldest command is
 * dropped; this only forfeits undo depth. Mutations that bypass the log must {@link #clear()} it first, since
 * the remaining commands describe positions that no longer exist.
 */
public final class MutationLog {

    private static final Logger log = LoggerFactory.getLogger(MutationLog.class);

    private final Deque<MutationCommand> undoStack = new ArrayDeque<>();
    private final Deque<MutationCommand> redoStack = new ArrayDeque<>();
    private final int capacity;

    public MutationLog(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Undo capacity must be non-negative");
        }
        this.capacity = capacity;
    }

    void execute(MutationCommand command) {
        command.apply();
        redoStack.clear();
        if (capacity == 0) {
            return;
        }
        undoStack.push(command);
        while (undoStack.size() > capacity) {
            MutationCommand dropped = undoStack.removeLast();
            log.trace("Undo history full, dropping '{}'", dropped.description());
        }
    }

    /**
     * Reverts the most recent command.
     *
     * @return false if there was nothing to undo
     */
    public boolean undo() {
        MutationCommand command = undoStack.poll();
        if (command == null) {
            return false;
        }
        command.revert();
        redoStack.push(command);
        return true;
    }

    /**
     * Re-applies the most recently undone command.
     *
     * @return false if there was nothing to redo
     */
    public boolean redo() {
        MutationCommand command = redoStack.poll();
        if (command == null) {
            return false;
        }
        command.apply();
        undoStack.push(command);
        return true;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int undoDepth() {
        return undoStack.size();
    }

    public int redoDepth() {
        return redoStack.size();
    }

    public int capacity() {
        return capacity;
    }

    public Optional<String> undoDescription() {
        return Optional.ofNullable(undoStack.peek()).map(MutationCommand::description);
    }

    public Optional<String> redoDescription() {
        return Optional.ofNullable(redoStack.peek()).map(MutationCommand::description);
    }

    void clear() {
        undoStack.clear();
        redoStack.clear();
    }
}
