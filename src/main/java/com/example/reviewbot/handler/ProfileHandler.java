package com.example.reviewbot.handler;

import com.example.reviewbot.error.NotFoundException;
import com.example.reviewbot.model.ConversationState;
import com.example.reviewbot.model.Session;
import com.example.reviewbot.model.SessionContext;
import com.example.reviewbot.router.BotReply;
import com.example.reviewbot.router.Button;
import com.example.reviewbot.router.TextInputHandler;
import com.example.reviewbot.router.Tokens;
import com.example.reviewbot.service.UserProfileService;
import com.example.reviewbot.session.ConversationFlow;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the public name and promotion tag of a subject posting a non-anonymous review,
 * then hands back to the review wizard.
 */
@Component
public class ProfileHandler implements TextInputHandler {

    private final ConversationFlow flow;
    private final UserProfileService profileService;
    private final DraftingHandler draftingHandler;

    public ProfileHandler(ConversationFlow flow, UserProfileService profileService, DraftingHandler draftingHandler) {
        this.flow = flow;
        this.profileService = profileService;
        this.draftingHandler = draftingHandler;
    }

    @Override
    public Set<ConversationState> states() {
        return EnumSet.of(ConversationState.COLLECTING_PROFILE_NAME, ConversationState.COLLECTING_PROFILE_TAG);
    }

    @Override
    public BotReply handleText(long subjectId, Session session, String text) {
        SessionContext context = session.getContext() == null ? SessionContext.empty() : session.getContext();
        if (session.getState() == ConversationState.COLLECTING_PROFILE_NAME) {
            String name = profileService.normalizeName(text);
            flow.moveTo(subjectId, ConversationState.COLLECTING_PROFILE_TAG, context.toBuilder().profileName(name).build());
            return BotReply.success("Thanks, " + name + ". What is your promotion? ("
                    + UserProfileService.PROMOTION_LENGTH + " characters, e.g. 2027)",
                    List.of(List.of(new Button("Cancel", Tokens.CANCEL_REVIEW))));
        }

        String promotion = profileService.normalizePromotion(text);
        if (context.getProfileName() == null) {
            throw new NotFoundException("Profile name was lost");
        }
        profileService.save(subjectId, context.getProfileName(), promotion);
        flow.moveTo(subjectId, ConversationState.DRAFTING, context.toBuilder().profileName(null).build());
        return draftingHandler.confirmation(subjectId);
    }
}
