package com.careerbuddy.bot.repository;

import com.careerbuddy.bot.model.Tier;
import com.careerbuddy.bot.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {
    Optional<User> findByTelegramId(Long telegramId);

    long countByTier(Tier tier);

    List<User> findByTierAndPremiumExpiresAtBefore(Tier tier, LocalDateTime now);

    List<User> findByTierAndPremiumExpiresAtBetween(Tier tier, LocalDateTime from, LocalDateTime to);

    List<User> findByQuotaResetAtBefore(LocalDateTime now);
}
