package com.composum.platform.remap.logging;

import org.slf4j.Logger;
import org.slf4j.helpers.MessageFormatter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A message about the remapping of a copied tree that can be presented to the user, e.g. that a referenced node
 * could not be found. The {@link #getContext()} names the node the message is about.
 */
public class Message {

    protected final Level level;

    /** Text with {@literal {}} placeholders as in SLF4J. */
    protected final String message;

    @Nullable
    protected final Object[] arguments;

    /** Path of the node this is about. */
    @Nullable
    protected String context;

    @Nullable
    protected List<Message> details;

    /**
     * @param level     the severity, {@link Level#info} if null
     * @param message   the text, possibly with placeholders {@literal {}} for the arguments
     * @param arguments the values for the placeholders
     */
    public Message(@Nullable Level level, @Nonnull String message, Object... arguments) {
        this.level = level != null ? level : Level.info;
        this.message = message;
        this.arguments = arguments != null && arguments.length > 0 ? arguments : null;
    }

    @Nonnull
    public static Message error(@Nonnull String message, Object... arguments) {
        return new Message(Level.error, message, arguments);
    }

    @Nonnull
    public static Message warn(@Nonnull String message, Object... arguments) {
        return new Message(Level.warn, message, arguments);
    }

    @Nonnull
    public static Message info(@Nonnull String message, Object... arguments) {
        return new Message(Level.info, message, arguments);
    }

    @Nonnull
    public static Message debug(@Nonnull String message, Object... arguments) {
        return new Message(Level.debug, message, arguments);
    }

    /** Appends a message that explains this one, e.g. the failure of the repository. */
    @Nonnull
    public Message addDetail(@Nonnull Message detail) {
        if (details == null) {
            details = new ArrayList<>();
        }
        details.add(detail);
        return this;
    }

    @Nonnull
    public Level getLevel() {
        return level;
    }

    /** The unformatted text, see {@link #toFormattedMessage()}. */
    @Nonnull
    public String getMessage() {
        return message;
    }

    @Nonnull
    public List<Object> getArguments() {
        return arguments != null ? Arrays.asList(arguments) : Collections.emptyList();
    }

    /** The path of the node the message is about, if any. */
    @Nullable
    public String getContext() {
        return context;
    }

    @Nonnull
    public Message setContext(@Nullable String context) {
        this.context = context;
        return this;
    }

    @Nonnull
    public List<Message> getDetails() {
        return details != null ? Collections.unmodifiableList(details) : Collections.emptyList();
    }

    /**
     * Writes {@link #toFormattedMessage()} into the log with the level of this message.
     *
     * @param log   nothing is logged if null
     * @param cause optional exception logged with the message
     */
    @Nonnull
    public Message logInto(@Nullable Logger log, @Nullable Throwable cause) {
        if (log == null) {
            return this;
        }
        switch (level) {
            case error:
                if (log.isErrorEnabled()) {
                    log.error(toFormattedMessage(), cause);
                }
                break;
            case warn:
                if (log.isWarnEnabled()) {
                    log.warn(toFormattedMessage(), cause);
                }
                break;
            case debug:
                if (log.isDebugEnabled()) {
                    log.debug(toFormattedMessage(), cause);
                }
                break;
            default:
                if (log.isInfoEnabled()) {
                    log.info(toFormattedMessage(), cause);
                }
        }
        return this;
    }

    /**
     * The text with the arguments filled in, followed by the context in brackets and an indented list of the
     * details. Details with another level than this message are prefixed with their level.
     */
    @Nonnull
    public String toFormattedMessage() {
        StringBuilder buf = new StringBuilder();
        format(buf, "", level);
        return buf.toString();
    }

    protected void format(@Nonnull StringBuilder buf, @Nonnull String indent, @Nonnull Level parentLevel) {
        buf.append(indent);
        if (level != parentLevel) {
            buf.append(level.name()).append(": ");
        }
        buf.append(arguments != null ? MessageFormatter.arrayFormat(message, arguments).getMessage() : message);
        if (context != null) {
            buf.append(" [").append(context).append("]");
        }
        if (details != null) {
            String detailIndent = indent + "    ";
            buf.append("\n").append(detailIndent).append("Details:");
            for (Message detail : details) {
                buf.append("\n");
                detail.format(buf, detailIndent, parentLevel);
            }
        }
    }

    @Override
    public String toString() {
        return level + ": " + toFormattedMessage();
    }

    public enum Level {
        /** The remapping could not be done at all. */
        error,
        /** A node or reference was skipped; the copy might still point into the original tree there. */
        warn,
        /** Informational messages, e.g. about the number of changed fields. */
        info,
        /** Details that are not normally shown to users. */
        debug
    }

}
