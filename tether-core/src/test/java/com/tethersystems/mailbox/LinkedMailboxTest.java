package com.tethersystems.mailbox;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinkedMailboxTest {

    @Test
    void testBoundedMailboxRejectsWhenFull() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>(2);

        assertTrue(mailbox.offer("a"));
        assertTrue(mailbox.offer("b"));
        assertFalse(mailbox.offer("c"));

        assertEquals(2, mailbox.capacity());
        assertEquals("a", mailbox.poll());
        assertTrue(mailbox.offer("c"));
    }

    @Test
    void testUnboundedMailbox() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>();

        for (int i = 0; i < 1000; i++) {
            assertTrue(mailbox.offer("msg" + i));
        }
        assertEquals(Integer.MAX_VALUE, mailbox.capacity());
        assertEquals(1000, mailbox.size());
    }

    @Test
    void testOfferRejectsNull() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>();
        assertThrows(NullPointerException.class, () -> mailbox.offer(null));
    }
}
