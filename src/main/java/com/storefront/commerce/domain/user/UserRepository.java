package com.storefront.commerce.domain.user;

import java.util.Optional;

/**
 * User Repository Interface (Domain Layer - Port)
 */
public interface UserRepository {

    Optional<User> findById(Long userId);

    boolean existsById(Long userId);

    User save(User user);
}
