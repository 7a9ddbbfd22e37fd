package com.gaslessmint.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for users. Atomic create and wallet attach live in {@link UserRepositoryCustom}.
 */
public interface UserRepository extends MongoRepository<User, String>, UserRepositoryCustom {

    Optional<User> findByEmail(String email);
}
