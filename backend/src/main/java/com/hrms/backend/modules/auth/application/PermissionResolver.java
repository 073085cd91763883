package com.hrms.backend.modules.auth.application;

import java.util.List;
import java.util.TreeSet;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hrms.backend.global.config.SecurityProperties;
import com.hrms.backend.modules.auth.infrastructure.cache.CacheKeys;
import com.hrms.backend.modules.auth.infrastructure.cache.SecurityCache;
import com.hrms.backend.modules.auth.infrastructure.persistence.UserRoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Expands a user's active role grants into role and permission slugs.
 * <p>
 * Results are cached for a bounded TTL. A cache that cannot be read or written degrades to the
 * relational store; a cache entry that cannot be evicted fails the calling mutation.
 */
@Service
public class PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

    private final UserRoleRepository userRoleRepository;
    private final SecurityCache cache;
    private final ObjectMapper objectMapper;
    private final SecurityProperties properties;

    public PermissionResolver(
            UserRoleRepository userRoleRepository,
            SecurityCache cache,
            ObjectMapper objectMapper,
            SecurityProperties properties
    ) {
        this.userRoleRepository = userRoleRepository;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public PermissionSet resolve(UUID userId) {
        String key = key(userId);
        PermissionSet cached = readCached(key);
        if (cached != null) {
            return cached;
        }
        PermissionSet loaded = load(userId);
        writeCached(key, loaded);
        return loaded;
    }

    public void evict(UUID userId) {
        cache.delete(key(userId));
        log.info("Evicted permission cache for user {}", userId);
    }

    /**
     * Evicts now and again once the surrounding transaction commits, so a concurrent
     * {@link #resolve} cannot re-cache the pre-commit grants.
     */
    public void evictNowAndAfterCommit(UUID userId) {
        evict(userId);
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    evict(userId);
                } catch (DataAccessException ex) {
                    log.error("Post-commit permission cache eviction failed for user {}", userId, ex);
                }
            }
        });
    }

    private PermissionSet load(UUID userId) {
        List<String> roles = List.copyOf(new TreeSet<>(userRoleRepository.findActiveRoleSlugs(userId)));
        List<String> permissions = List.copyOf(new TreeSet<>(userRoleRepository.findActivePermissionSlugs(userId)));
        return new PermissionSet(roles, permissions);
    }

    private PermissionSet readCached(String key) {
        try {
            String json = cache.get(key).orElse(null);
            if (json == null) {
                return null;
            }
            return objectMapper.readValue(json, PermissionSet.class);
        } catch (DataAccessException ex) {
            log.warn("Permission cache read failed for {}, loading from store: {}", key, ex.getMessage());
            return null;
        } catch (JsonProcessingException ex) {
            log.warn("Discarding unreadable permission cache entry {}", key);
            return null;
        }
    }

    private void writeCached(String key, PermissionSet value) {
        try {
            cache.set(key, objectMapper.writeValueAsString(value), properties.getPermissionCacheTtl());
        } catch (DataAccessException ex) {
            log.warn("Permission cache write failed for {}: {}", key, ex.getMessage());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialise permission set", ex);
        }
    }

    static String key(UUID userId) {
        return CacheKeys.PERMISSIONS + userId;
    }
}
