package com.careerbuddy.bot.repository;

import com.careerbuddy.bot.model.Job;
import com.careerbuddy.bot.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JobRepository extends JpaRepository<Job, Long> {

    Optional<Job> findFirstByUserTelegramIdAndStatusNotOrderByCreatedAtDesc(Long telegramId, JobStatus status);

    Optional<Job> findFirstByUserTelegramIdAndStatusOrderByCreatedAtDesc(Long telegramId, JobStatus status);

    /** Newest job whatever its status; holds the last processed message id once the open job is closed. */
    Optional<Job> findFirstByUserTelegramIdOrderByIdDesc(Long telegramId);
}
