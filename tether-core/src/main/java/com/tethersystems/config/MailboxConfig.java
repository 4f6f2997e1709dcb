package com.tethersystems.config;

import com.tethersystems.mailbox.LinkedMailbox;
import com.tethersystems.mailbox.Mailbox;
import com.tethersystems.mailbox.MpscMailbox;

/**
 * Configuration for actor mailboxes.
 */
public class MailboxConfig {
    public static final int DEFAULT_INITIAL_CAPACITY = 64;
    public static final int DEFAULT_MAX_CAPACITY = 10_000;
    public static final int DEFAULT_BATCH_SIZE = 10;

    /**
     * Queue implementation used for a mailbox.
     */
    public enum MailboxType {
        /** Unbounded lock-free JCTools queue. */
        MPSC,
        /** Bounded LinkedBlockingQueue, capped at {@link #getMaxCapacity()}. */
        LINKED
    }

    private int initialCapacity = DEFAULT_INITIAL_CAPACITY;
    private int maxCapacity = DEFAULT_MAX_CAPACITY;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private MailboxType mailboxType = MailboxType.MPSC;

    /**
     * Creates a new mailbox according to this configuration.
     *
     * @param <T> The message type
     * @return A fresh, empty mailbox
     */
    public <T> Mailbox<T> createMailbox() {
        switch (mailboxType) {
            case LINKED:
                return new LinkedMailbox<>(maxCapacity);
            case MPSC:
                return new MpscMailbox<>(initialCapacity);
            default:
                throw new IllegalStateException("Unknown mailbox type: " + mailboxType);
        }
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public MailboxConfig setInitialCapacity(int initialCapacity) {
        this.initialCapacity = initialCapacity;
        return this;
    }

    public int getMaxCapacity() {
        return maxCapacity;
    }

    public MailboxConfig setMaxCapacity(int maxCapacity) {
        this.maxCapacity = maxCapacity;
        return this;
    }

    /**
     * Number of messages drained from the mailbox per loop iteration.
     *
     * @return the batch size
     */
    public int getBatchSize() {
        return batchSize;
    }

    public MailboxConfig setBatchSize(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1");
        }
        this.batchSize = batchSize;
        return this;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    public MailboxConfig setMailboxType(MailboxType mailboxType) {
        this.mailboxType = mailboxType;
        return this;
    }
}
