package com.example.projectservice.service;

import com.example.projectservice.entity.User;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Resolves user accounts owned by the user-management side.
 * Lookups never create or modify users.
 */
public interface UserResolver {

    /**
     * Case-insensitive lookup.
     */
    Optional<User> findUserByEmail(String email);

    /**
     * Batched lookup; ids without a matching user are simply absent from the result.
     */
    List<User> findUsersByIds(Collection<Long> userIds);
}
