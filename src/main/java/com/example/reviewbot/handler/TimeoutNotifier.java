package com.example.reviewbot.handler;

import com.example.reviewbot.draft.DraftEditor;
import com.example.reviewbot.router.BotReply;
import com.example.reviewbot.router.Button;
import com.example.reviewbot.router.Keyboards;
import com.example.reviewbot.router.ReplyType;
import com.example.reviewbot.router.Tokens;
import com.example.reviewbot.session.TimeoutInfo;
import com.example.reviewbot.session.TimeoutListener;
import com.example.reviewbot.transport.ChatTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TimeoutNotifier implements TimeoutListener {

    private static final Logger logger = LoggerFactory.getLogger(TimeoutNotifier.class);

    private final ChatTransport transport;
    private final DraftEditor draftEditor;

    public TimeoutNotifier(ChatTransport transport, DraftEditor draftEditor) {
        this.transport = transport;
        this.draftEditor = draftEditor;
    }

    @Override
    public void onWarning(long subjectId, TimeoutInfo info) {
        long minutes = Math.max(1, info.timeUntilExpiry().toMinutes());
        transport.send(subjectId, new BotReply(ReplyType.TIMEOUT_WARNING,
                "Your session will close in " + minutes + " minute(s) without activity.",
                List.of(List.of(new Button("Keep going", Tokens.NOOP)))));
    }

    @Override
    public void onExpired(long subjectId) {
        try {
            draftEditor.discard(subjectId);
        } catch (RuntimeException e) {
            logger.warn("Could not discard draft of {} on expiry: {}", subjectId, e.getMessage());
        }
        transport.send(subjectId, new BotReply(ReplyType.TIMEOUT_EXPIRED,
                "Your session closed after 30 minutes without activity. Unsaved changes were discarded.",
                Keyboards.mainMenu()));
    }
}
