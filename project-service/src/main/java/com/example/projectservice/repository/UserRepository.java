package com.example.projectservice.repository;

import com.example.projectservice.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the user table.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findFirstByEmailIgnoreCase(String email);

    List<User> findAllByIdIn(Collection<Long> ids);
}
