package com.pianola.mailbox.config;

import com.pianola.mailbox.LinkedMailbox;
import com.pianola.mailbox.Mailbox;
import com.pianola.mailbox.MpscMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default mailbox provider that picks the implementation named by {@link MailboxConfig#getMailboxType()}.
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        MailboxConfig effectiveConfig = (config != null) ? config : new MailboxConfig();
        logger.debug("Creating mailbox with {}", effectiveConfig);

        switch (effectiveConfig.getMailboxType()) {
            case MPSC:
                return new MpscMailbox<>();
            case LINKED:
                return new LinkedMailbox<>(effectiveConfig.getMaxCapacity());
            default:
                throw new IllegalArgumentException("Unknown mailbox type: " + effectiveConfig.getMailboxType());
        }
    }
}
