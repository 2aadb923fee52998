package com.example.reviewbot.transport;

import com.example.reviewbot.router.BotReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Default transport: logs the message. Delivery to the messenger is handled outside this service. */
@Component
public class LoggingChatTransport implements ChatTransport {

    private static final Logger logger = LoggerFactory.getLogger(LoggingChatTransport.class);

    @Override
    public void send(long subjectId, BotReply reply) {
        logger.info("-> {} [{}] {}", subjectId, reply.type(), reply.text());
    }
}
