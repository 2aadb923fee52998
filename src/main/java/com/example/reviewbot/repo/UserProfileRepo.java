package com.example.reviewbot.repo;

import com.example.reviewbot.model.UserProfile;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface UserProfileRepo extends MongoRepository<UserProfile, Long> {}
