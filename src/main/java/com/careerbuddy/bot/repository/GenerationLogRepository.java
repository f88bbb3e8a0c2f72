package com.careerbuddy.bot.repository;

import com.careerbuddy.bot.model.GenerationLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GenerationLogRepository extends JpaRepository<GenerationLog, Long> {

    List<GenerationLog> findTop5ByUserTelegramIdOrderByGeneratedAtDesc(Long telegramId);

    Optional<GenerationLog> findFirstByUserTelegramIdOrderByGeneratedAtDesc(Long telegramId);

    @Query("SELECT COUNT(g) FROM GenerationLog g WHERE g.paid = true")
    long countPaidGenerations();
}
