package com.example.reviewbot.handler;

import com.example.reviewbot.draft.DraftEditor;
import com.example.reviewbot.router.*;
import com.example.reviewbot.session.ConversationFlow;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
public class NavigationHandler implements CallbackHandler {

    static final String HELP_TEXT = "Browse courses to read reviews and vote on them, "
            + "post one review per course, and edit or delete your reviews from My reviews. "
            + "Sessions close after 30 minutes without activity.";

    private final ConversationFlow flow;
    private final DraftEditor draftEditor;

    public NavigationHandler(ConversationFlow flow, DraftEditor draftEditor) {
        this.flow = flow;
        this.draftEditor = draftEditor;
    }

    @Override
    public Set<CallbackAction> actions() {
        return EnumSet.of(CallbackAction.MAIN_MENU, CallbackAction.HELP, CallbackAction.NOOP);
    }

    @Override
    public BotReply handle(long subjectId, CallbackToken token) {
        switch (token.action()) {
            case MAIN_MENU:
                return mainMenu(subjectId, "Main menu");
            case HELP:
                return help(subjectId);
            default:
                return BotReply.of(ReplyType.IGNORED, "");
        }
    }

    public BotReply start(long subjectId) {
        return mainMenu(subjectId, "Welcome! What would you like to do?");
    }

    public BotReply help(long subjectId) {
        return BotReply.success(HELP_TEXT, List.of(Keyboards.backToMenu()));
    }

    public BotReply mainMenu(long subjectId, String text) {
        draftEditor.discard(subjectId);
        flow.reset(subjectId);
        return BotReply.success(text, Keyboards.mainMenu());
    }
}
