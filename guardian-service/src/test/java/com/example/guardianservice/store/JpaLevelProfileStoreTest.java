package com.example.guardianservice.store;

import com.example.guardianservice.config.CacheSettings;
import com.example.guardianservice.entity.LevelProfile;
import com.example.guardianservice.repository.LevelProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Cache consistency of the level profile store around database writes.
 */
class JpaLevelProfileStoreTest {

    private static final long GUILD_ID = 12L;
    private static final long USER_ID = 34L;

    @Mock
    private LevelProfileRepository repository;

    private JpaLevelProfileStore store;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        store = new JpaLevelProfileStore(repository, CacheSettings.defaults());
    }

    private static LevelProfile profile(long xp) {
        LevelProfile profile = LevelProfile.fresh(GUILD_ID, USER_ID);
        profile.setXp(xp);
        return profile;
    }

    @Test
    void testFind_ReturnedProfileModified_CacheUnaffected() {
        // GIVEN
        when(repository.findByGuildIdAndUserId(GUILD_ID, USER_ID)).thenReturn(Optional.of(profile(100)));
        LevelProfile first = store.find(GUILD_ID, USER_ID).orElseThrow();

        // WHEN
        first.setXp(9_999);

        // THEN
        assertThat(store.find(GUILD_ID, USER_ID).orElseThrow().getXp()).isEqualTo(100);
        verify(repository, times(1)).findByGuildIdAndUserId(GUILD_ID, USER_ID);
    }

    @Test
    void testSave_UpsertFails_CachedProfileDroppedAndReloaded() {
        // GIVEN: the row is cached at 100 XP
        when(repository.findByGuildIdAndUserId(GUILD_ID, USER_ID)).thenReturn(Optional.of(profile(100)));
        LevelProfile working = store.find(GUILD_ID, USER_ID).orElseThrow();
        working.setXp(600);
        when(repository.upsert(any())).thenThrow(new DataAccessResourceFailureException("connection reset"));

        // WHEN
        assertThatThrownBy(() -> store.save(working))
                .isInstanceOf(DataAccessResourceFailureException.class);

        // THEN: the next read goes back to the database and sees the committed value
        assertThat(store.find(GUILD_ID, USER_ID).orElseThrow().getXp()).isEqualTo(100);
        verify(repository, times(2)).findByGuildIdAndUserId(GUILD_ID, USER_ID);
    }

    @Test
    void testSave_UpsertSucceeds_LaterChangesToCallerCopyNotCached() {
        // GIVEN
        LevelProfile saved = profile(250);
        when(repository.upsert(any())).thenReturn(1);
        store.save(saved);

        // WHEN
        saved.setXp(0);

        // THEN: served from the cache without a database read
        assertThat(store.find(GUILD_ID, USER_ID).orElseThrow().getXp()).isEqualTo(250);
        verify(repository, times(0)).findByGuildIdAndUserId(GUILD_ID, USER_ID);
    }
}
