package com.composum.platform.remap;

import com.composum.platform.remap.logging.Message;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Reports that the content repository refused or failed an operation - usually the commit of a field edit.
 */
public class ContentAccessException extends Exception {

    @Nonnull
    protected final Message message;

    public ContentAccessException(@Nonnull Message message, @Nullable Throwable cause) {
        super(message.toFormattedMessage(), cause);
        this.message = message;
        if (cause != null) {
            message.addDetail(Message.debug("Exception details: {}", cause.toString()));
        }
    }

    /** A description of the failure that can be presented to the user. */
    @Nonnull
    public Message getMessageObject() {
        return message;
    }

}
