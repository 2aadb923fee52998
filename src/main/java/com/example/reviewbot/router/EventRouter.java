package com.example.reviewbot.router;

import com.example.reviewbot.draft.DraftEditor;
import com.example.reviewbot.error.*;
import com.example.reviewbot.handler.NavigationHandler;
import com.example.reviewbot.model.ConversationState;
import com.example.reviewbot.model.Session;
import com.example.reviewbot.model.SessionContext;
import com.example.reviewbot.quota.DenialReason;
import com.example.reviewbot.quota.QuotaDecision;
import com.example.reviewbot.quota.QuotaGate;
import com.example.reviewbot.session.ConversationFlow;
import com.example.reviewbot.session.TimeoutSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.function.LongFunction;

/**
 * Entry point for every inbound event.
 * <p>
 * Order per event: quota check, session renewal, dispatch (command table, parsed
 * callback action, or free text by session state), timer realignment, and finally
 * counting the message against the quota. Handler exceptions are turned into replies
 * here and nowhere else.
 */
@Service
public class EventRouter {

    private static final Logger logger = LoggerFactory.getLogger(EventRouter.class);

    static final String MDC_SUBJECT = "subjectId";

    private static final DateTimeFormatter RESET_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm VV");

    private final QuotaGate quotaGate;
    private final TimeoutSupervisor timeoutSupervisor;
    private final ConversationFlow flow;
    private final DraftEditor draftEditor;
    private final CallbackTokenParser tokenParser;
    private final Map<String, LongFunction<BotReply>> commands;
    private final Map<CallbackAction, CallbackHandler> callbackHandlers = new EnumMap<>(CallbackAction.class);
    private final Map<ConversationState, TextInputHandler> textHandlers = new EnumMap<>(ConversationState.class);

    public EventRouter(QuotaGate quotaGate, TimeoutSupervisor timeoutSupervisor,
                       ConversationFlow flow, DraftEditor draftEditor, CallbackTokenParser tokenParser,
                       NavigationHandler navigation, List<CallbackHandler> callbackHandlers,
                       List<TextInputHandler> textHandlers) {
        this.quotaGate = quotaGate;
        this.timeoutSupervisor = timeoutSupervisor;
        this.flow = flow;
        this.draftEditor = draftEditor;
        this.tokenParser = tokenParser;
        this.commands = Map.of(
                "start", navigation::start,
                "help", navigation::help);
        for (CallbackHandler handler : callbackHandlers) {
            for (CallbackAction action : handler.actions()) {
                CallbackHandler previous = this.callbackHandlers.put(action, handler);
                if (previous != null) {
                    throw new IllegalStateException("Action " + action + " bound twice: "
                            + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
                }
            }
        }
        for (TextInputHandler handler : textHandlers) {
            for (ConversationState state : handler.states()) {
                this.textHandlers.put(state, handler);
            }
        }
        EnumSet<CallbackAction> unbound = EnumSet.allOf(CallbackAction.class);
        unbound.removeAll(this.callbackHandlers.keySet());
        if (!unbound.isEmpty()) {
            logger.warn("Callback actions without a handler: {}", unbound);
        }
    }

    public BotReply handle(InboundEvent event) {
        long subjectId = event.subjectId();
        MDC.put(MDC_SUBJECT, String.valueOf(subjectId));
        try {
            BotReply reply;
            boolean accepted = false;
            try {
                QuotaDecision decision = quotaGate.checkAndConsider(subjectId);
                if (!decision.allowed()) {
                    throw new RateLimitedException(decision);
                }
                accepted = true;
                timeoutSupervisor.renew(subjectId);
                reply = dispatch(subjectId, event);
            } catch (ReviewBotException e) {
                reply = recover(subjectId, e);
            } catch (RuntimeException e) {
                logger.error("Unhandled failure routing {} event", event.kind(), e);
                reply = unavailable();
            }

            if (accepted) {
                afterDispatch(subjectId, reply);
            }
            logger.debug("{} event answered with {}", event.kind(), reply.type());
            return reply;
        } finally {
            MDC.remove(MDC_SUBJECT);
        }
    }

    BotReply dispatch(long subjectId, InboundEvent event) {
        EventKind kind = event.kind() != null ? event.kind() : inferKind(event);
        switch (kind) {
            case COMMAND:
                return dispatchCommand(subjectId, event.commandToken());
            case CALLBACK:
                return dispatchCallback(subjectId, event.callbackToken());
            default:
                return dispatchText(subjectId, event.text());
        }
    }

    private BotReply dispatchCommand(long subjectId, String raw) {
        String command = normalizeCommand(raw);
        LongFunction<BotReply> handler = commands.get(command);
        if (handler == null) {
            logger.debug("Unknown command {}", raw);
            return BotReply.of(ReplyType.UNKNOWN_COMMAND, "Unknown command. Use /start or /help.");
        }
        return handler.apply(subjectId);
    }

    private BotReply dispatchCallback(long subjectId, String raw) {
        Optional<CallbackToken> parsed = tokenParser.parse(raw);
        CallbackHandler handler = parsed.map(t -> callbackHandlers.get(t.action())).orElse(null);
        if (handler == null) {
            logger.debug("Unknown callback token {}", raw);
            return BotReply.of(ReplyType.UNKNOWN_ACTION, "Unknown action.").withKeyboard(List.of(Keyboards.backToMenu()));
        }
        return handler.handle(subjectId, parsed.get());
    }

    private BotReply dispatchText(long subjectId, String text) {
        Session session = flow.current(subjectId);
        TextInputHandler handler = textHandlers.get(session.getState());
        if (handler == null) {
            List<List<Button>> keyboard = session.getState() == ConversationState.ROOT
                    ? Keyboards.mainMenu() : List.of(Keyboards.backToMenu());
            return new BotReply(ReplyType.UNRECOGNIZED_INPUT, "Please use the buttons below.", keyboard);
        }
        return handler.handleText(subjectId, session, text);
    }

    private BotReply recover(long subjectId, ReviewBotException e) {
        try {
            return toReply(subjectId, e);
        } catch (RuntimeException failure) {
            logger.error("Could not recover from {}", e.getClass().getSimpleName(), failure);
            return unavailable();
        }
    }

    private BotReply toReply(long subjectId, ReviewBotException e) {
        if (e instanceof RateLimitedException) {
            QuotaDecision decision = ((RateLimitedException) e).getDecision();
            logger.warn("Rate limit hit ({}): daily {}/{}, lifetime {}/{}", decision.reason(),
                    decision.dailyCount(), decision.dailyLimit(), decision.lifetimeCount(), decision.lifetimeLimit());
            String text = decision.reason() == DenialReason.DAILY
                    ? "You have reached the daily limit of " + decision.dailyLimit() + " messages. Try again after "
                        + RESET_FORMAT.format(decision.resetTime().atZone(quotaGate.zone())) + "."
                    : "You have reached the maximum number of messages for this account.";
            return BotReply.of(ReplyType.RATE_LIMITED, text);
        }
        if (e instanceof InvalidTransitionException) {
            logger.warn("{}; resetting to ROOT", e.getMessage());
            return resetTo(subjectId, ReplyType.RESET, "Something went out of step, back to the main menu.");
        }
        if (e instanceof ValidationException) {
            return BotReply.of(ReplyType.VALIDATION_ERROR, e.getMessage());
        }
        if (e instanceof DuplicateSubmissionException) {
            return duplicate(subjectId, (DuplicateSubmissionException) e);
        }
        if (e instanceof NotFoundException) {
            logger.debug("Not found: {}", e.getMessage());
            return resetTo(subjectId, ReplyType.NOT_FOUND, e.getMessage() + ". Back to the main menu.");
        }
        if (e instanceof ConflictException) {
            return BotReply.of(ReplyType.CONFLICT, e.getMessage());
        }
        if (e instanceof StoreUnavailableException) {
            return unavailable();
        }
        logger.error("Unmapped failure", e);
        return unavailable();
    }

    /** DRAFTING -> ROOT -> VIEWING_OWN_RECORDS, offering to edit the review that already exists. */
    private BotReply duplicate(long subjectId, DuplicateSubmissionException e) {
        draftEditor.discard(subjectId);
        flow.reset(subjectId);
        flow.moveTo(subjectId, ConversationState.VIEWING_OWN_RECORDS,
                SessionContext.builder().reviewId(e.getExistingReviewId()).courseId(e.getCourseId()).build());
        List<List<Button>> rows = new ArrayList<>();
        if (e.getExistingReviewId() != null) {
            rows.add(List.of(new Button("Edit my review", Tokens.editReview(e.getExistingReviewId()))));
        }
        rows.add(List.of(new Button("My reviews", Tokens.MY_REVIEWS)));
        rows.add(Keyboards.backToMenu());
        return new BotReply(ReplyType.DUPLICATE_SUBMISSION,
                "You have already reviewed " + e.getCourseId() + ". Would you like to edit that review instead?", rows);
    }

    /** A move back to ROOT ends the editing session, so its draft goes too. */
    private BotReply resetTo(long subjectId, ReplyType type, String text) {
        draftEditor.discard(subjectId);
        flow.reset(subjectId);
        return new BotReply(type, text, Keyboards.mainMenu());
    }

    private void afterDispatch(long subjectId, BotReply reply) {
        try {
            timeoutSupervisor.track(subjectId);
            if (reply.type() != ReplyType.UNAVAILABLE) {
                quotaGate.recordAccepted(subjectId);
            }
        } catch (StoreUnavailableException e) {
            logger.error("Could not finish bookkeeping for the event: {}", e.getMessage());
        }
    }

    private static BotReply unavailable() {
        return BotReply.of(ReplyType.UNAVAILABLE, "The service is temporarily unavailable, please try again in a moment.");
    }

    private static EventKind inferKind(InboundEvent event) {
        if (event.commandToken() != null) return EventKind.COMMAND;
        if (event.callbackToken() != null) return EventKind.CALLBACK;
        return EventKind.TEXT;
    }

    /** "/start@bot arg" -> "start" */
    static String normalizeCommand(String raw) {
        if (raw == null) return "";
        String command = raw.trim();
        int space = command.indexOf(' ');
        if (space >= 0) command = command.substring(0, space);
        if (command.startsWith("/")) command = command.substring(1);
        int at = command.indexOf('@');
        if (at >= 0) command = command.substring(0, at);
        return command.toLowerCase(Locale.ROOT);
    }
}
