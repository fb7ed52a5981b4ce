package com.example.guardianservice.repository;

import com.example.guardianservice.entity.LevelProfile;

/**
 * Custom repository interface for LevelProfile UPSERT operations.
 */
public interface LevelProfileRepositoryCustom {

    /**
     * Insert or update the profile keyed by (guild_id, user_id).
     *
     * @return number of affected rows (always 1)
     */
    int upsert(LevelProfile profile);
}
