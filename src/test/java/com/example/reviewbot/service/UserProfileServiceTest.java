package com.example.reviewbot.service;

import com.example.reviewbot.error.ValidationException;
import com.example.reviewbot.model.UserProfile;
import com.example.reviewbot.repo.UserProfileRepo;
import com.example.reviewbot.support.MutableClock;
import com.example.reviewbot.support.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserProfileServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T18:00:00Z");

    @Mock
    private UserProfileRepo profileRepo;

    private UserProfileService profileService;

    @BeforeEach
    void setUp() {
        profileService = new UserProfileService(profileRepo, TestStores.storeRetry(), new MutableClock(NOW));
    }

    @Test
    void testNormalizeName_Bounds() {
        assertEquals("Jo", profileService.normalizeName("  Jo "));
        assertThrows(ValidationException.class, () -> profileService.normalizeName("J"));
        assertThrows(ValidationException.class, () -> profileService.normalizeName("x".repeat(41)));
        assertThrows(ValidationException.class, () -> profileService.normalizeName(null));
    }

    @Test
    void testNormalizePromotion_ExactLengthUppercased() {
        assertEquals("X26A", profileService.normalizePromotion(" x26a "));
        assertThrows(ValidationException.class, () -> profileService.normalizePromotion("27"));
    }

    @Test
    void testSave_NewProfile() {
        // Given
        when(profileRepo.findById(9L)).thenReturn(Optional.empty());
        when(profileRepo.save(any(UserProfile.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        UserProfile saved = profileService.save(9L, "Robin", "2027");

        // Then
        assertEquals(9L, saved.getSubjectId());
        assertEquals("Robin", saved.getName());
        assertEquals(NOW, saved.getCreatedAt());
        assertEquals(NOW, saved.getLastActive());
    }

    @Test
    void testSave_ExistingProfileKeepsCreatedAt() {
        // Given
        Instant created = Instant.parse("2025-09-01T08:00:00Z");
        when(profileRepo.findById(9L)).thenReturn(Optional.of(
                UserProfile.builder().subjectId(9L).name("Old").promotion("2026").createdAt(created).build()));
        when(profileRepo.save(any(UserProfile.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        UserProfile saved = profileService.save(9L, "New", "2027");

        // Then
        assertEquals("New", saved.getName());
        assertEquals(created, saved.getCreatedAt());
    }
}
