package com.composum.platform.remap.logging;

import org.slf4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A collection of {@link Message}s collected during a remapping, e.g. the nodes and references that had to be
 * skipped. Serves as the warning sink of a {@link com.composum.platform.remap.impl.RemapTask}.
 */
public class MessageContainer {

    /** A logger where {@link #add(Message)} automatically logs to. */
    @Nullable
    protected final Logger log;

    /** @see #getMessages() */
    @Nullable
    protected List<Message> messages;

    /** Creates a container that does not log the added messages. */
    public MessageContainer() {
        this(null);
    }

    /**
     * Constructor that allows to set a logger to which {@link #add(Message)} automatically writes the messages.
     *
     * @param log an optional log to which added messages are logged.
     */
    public MessageContainer(@Nullable Logger log) {
        this.log = log;
    }

    /** A (unmodifiable) list of messages. */
    @Nonnull
    public List<Message> getMessages() {
        return messages != null ? Collections.unmodifiableList(messages) : Collections.emptyList();
    }

    /** The messages with the given level, in the order they were added. */
    @Nonnull
    public List<Message> getMessages(@Nonnull Message.Level level) {
        return getMessages().stream()
                .filter(message -> message.getLevel() == level)
                .collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return messages == null || messages.isEmpty();
    }

    /** True if there is at least one message of level {@link Message.Level#warn} or {@link Message.Level#error}. */
    public boolean hasProblems() {
        return getMessages().stream()
                .anyMatch(message -> message.getLevel() == Message.Level.warn || message.getLevel() == Message.Level.error);
    }

    /**
     * Adds a message to the container, and logs it into the logger if one was specified for this container.
     *
     * @return this MessageContainer, for builder-style operation chaining.
     */
    @Nonnull
    public MessageContainer add(@Nullable Message message, @Nullable Throwable throwable) {
        if (message != null) {
            if (messages == null) { messages = new ArrayList<>(); }
            messages.add(message);
            message.logInto(log, throwable);
        }
        return this;
    }

    /**
     * Adds a message to the container, and logs it into the logger if one was specified for this container.
     *
     * @return this MessageContainer, for builder-style operation chaining.
     */
    @Nonnull
    public MessageContainer add(@Nullable Message message) {
        return add(message, null);
    }

    @Override
    public String toString() {
        return getMessages().stream()
                .map(Message::toString)
                .collect(Collectors.joining("\n"));
    }

}
