package com.example.reviewbot.service;

import com.example.reviewbot.error.ValidationException;
import com.example.reviewbot.model.UserProfile;
import com.example.reviewbot.repo.UserProfileRepo;
import com.example.reviewbot.store.StoreRetry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Service
public class UserProfileService {

    public static final int NAME_MIN = 2;
    public static final int NAME_MAX = 40;
    public static final int PROMOTION_LENGTH = 4;

    private final UserProfileRepo profileRepo;
    private final StoreRetry storeRetry;
    private final Clock clock;

    public UserProfileService(UserProfileRepo profileRepo, StoreRetry storeRetry, Clock clock) {
        this.profileRepo = profileRepo;
        this.storeRetry = storeRetry;
        this.clock = clock;
    }

    public Optional<UserProfile> find(long subjectId) {
        return storeRetry.call("profile.get", () -> profileRepo.findById(subjectId));
    }

    public String normalizeName(String raw) {
        String name = raw == null ? "" : raw.trim();
        if (name.length() < NAME_MIN || name.length() > NAME_MAX) {
            throw new ValidationException("Name must be between " + NAME_MIN + " and " + NAME_MAX + " characters");
        }
        return name;
    }

    public String normalizePromotion(String raw) {
        String promotion = raw == null ? "" : raw.trim();
        if (promotion.length() != PROMOTION_LENGTH) {
            throw new ValidationException("Promotion must be exactly " + PROMOTION_LENGTH + " characters, e.g. 2027");
        }
        return promotion.toUpperCase();
    }

    public UserProfile save(long subjectId, String name, String promotion) {
        Instant now = clock.instant();
        UserProfile profile = find(subjectId).orElseGet(() -> UserProfile.builder()
                .subjectId(subjectId)
                .createdAt(now)
                .build());
        profile.setName(normalizeName(name));
        profile.setPromotion(normalizePromotion(promotion));
        profile.setLastActive(now);
        return storeRetry.call("profile.save", () -> profileRepo.save(profile));
    }
}
