package com.storefront.commerce.infrastructure.persistence.user;

import com.storefront.commerce.domain.user.User;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * User JPA Repository
 */
public interface UserJpaRepository extends JpaRepository<User, Long> {
}
