package com.pianola.mailbox.config;

import com.pianola.mailbox.LinkedMailbox;
import com.pianola.mailbox.Mailbox;
import com.pianola.mailbox.MpscMailbox;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DefaultMailboxProviderTest {

    private final DefaultMailboxProvider<String> provider = new DefaultMailboxProvider<>();

    @Test
    void defaultsToBoundedLinkedMailbox() {
        Mailbox<String> mailbox = provider.createMailbox(null);

        assertInstanceOf(LinkedMailbox.class, mailbox);
        assertEquals(MailboxConfig.DEFAULT_MAX_CAPACITY, mailbox.capacity());
    }

    @Test
    void honoursConfiguredCapacity() {
        Mailbox<String> mailbox = provider.createMailbox(new MailboxConfig().setMaxCapacity(3));
        assertEquals(3, mailbox.capacity());
    }

    @Test
    void createsMpscMailboxWhenRequested() {
        Mailbox<String> mailbox = provider.createMailbox(new MailboxConfig().setMailboxType(MailboxType.MPSC));
        assertInstanceOf(MpscMailbox.class, mailbox);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        MailboxConfig config = new MailboxConfig();
        assertThrows(IllegalArgumentException.class, () -> config.setMaxCapacity(0));
    }

    @Test
    void fluentSettersReturnSameConfig() {
        MailboxConfig config = new MailboxConfig();
        assertSame(config, config.setOverflowStrategy(OverflowStrategy.REJECT)
                .setEnqueueTimeout(Duration.ofMillis(10)));
        assertEquals(OverflowStrategy.REJECT, config.getOverflowStrategy());
        assertEquals(Duration.ofMillis(10), config.getEnqueueTimeout());
    }
}
