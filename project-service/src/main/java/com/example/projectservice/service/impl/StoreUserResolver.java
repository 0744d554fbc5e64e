package com.example.projectservice.service.impl;

import com.example.projectservice.entity.User;
import com.example.projectservice.repository.StoreCallHandler;
import com.example.projectservice.repository.UserRepository;
import com.example.projectservice.service.UserResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * UserResolver backed by the shared user table.
 */
@Service
@RequiredArgsConstructor
public class StoreUserResolver implements UserResolver {

    private final UserRepository userRepository;
    private final StoreCallHandler storeCallHandler;

    @Override
    public Optional<User> findUserByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        String normalized = email.trim();
        return storeCallHandler.handleStoreCall(
                () -> userRepository.findFirstByEmailIgnoreCase(normalized),
                "findUserByEmail");
    }

    @Override
    public List<User> findUsersByIds(Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return List.of();
        }
        return storeCallHandler.handleStoreCall(
                () -> userRepository.findAllByIdIn(userIds),
                "findUsersByIds");
    }
}
