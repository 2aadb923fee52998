package com.example.reviewbot.repo;

import com.example.reviewbot.model.Vote;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;

import java.util.Collection;
import java.util.List;

public interface VoteRepo extends MongoRepository<Vote, String> {

    List<Vote> findByReviewIdIn(Collection<String> reviewIds);

    long deleteByReviewId(String reviewId);

    /** Deletes the vote only if it still points in {@code direction}. */
    @Query(value = "{'_id': ?0, 'direction': ?1}", delete = true)
    long deleteIfDirection(String voteId, String direction);

    /** Flips the vote only if it still points in {@code expected}. */
    @Query("{'_id': ?0, 'direction': ?1}")
    @Update("{'$set': {'direction': ?2}}")
    long swapDirection(String voteId, String expected, String replacement);
}
