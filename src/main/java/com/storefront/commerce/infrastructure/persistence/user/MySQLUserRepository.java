package com.storefront.commerce.infrastructure.persistence.user;

import com.storefront.commerce.domain.user.User;
import com.storefront.commerce.domain.user.UserRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 User Repository 구현
 */
@Repository
@Primary
public class MySQLUserRepository implements UserRepository {

    private final UserJpaRepository userJpaRepository;

    public MySQLUserRepository(UserJpaRepository userJpaRepository) {
        this.userJpaRepository = userJpaRepository;
    }

    @Override
    public Optional<User> findById(Long userId) {
        return userJpaRepository.findById(userId);
    }

    @Override
    public boolean existsById(Long userId) {
        return userJpaRepository.existsById(userId);
    }

    @Override
    public User save(User user) {
        return userJpaRepository.save(user);
    }
}
