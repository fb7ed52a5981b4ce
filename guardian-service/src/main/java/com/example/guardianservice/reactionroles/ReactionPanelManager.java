package com.example.guardianservice.reactionroles;

import com.example.guardianservice.client.ChannelSnapshot;
import com.example.guardianservice.client.DiscordPlatformClient;
import com.example.guardianservice.client.MemberSnapshot;
import com.example.guardianservice.client.MessageContent;
import com.example.guardianservice.client.RoleSnapshot;
import com.example.guardianservice.config.PanelSettings;
import com.example.guardianservice.entity.PanelRecord;
import com.example.guardianservice.entity.ReactionRoleEntry;
import com.example.guardianservice.exception.ReactionRoleConfigException;
import com.example.guardianservice.exception.RoleSelectionException;
import com.example.guardianservice.metrics.GuardianMetrics;
import com.example.guardianservice.overhaul.model.ChannelKind;
import com.example.guardianservice.overhaul.model.ConfigurationValidator;
import com.example.guardianservice.store.PanelRecordStore;
import com.example.guardianservice.store.ReactionRoleStore;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Owns the declarative reaction-role list of each guild and its single live panel message.
 * <p>
 * The list is kept dense: after every add, remove or reorder the entries are renumbered
 * 0..n-1. The panel location is stored as a {@link PanelRecord}; a missing message or channel
 * is recreated and the record overwritten, so a guild never accumulates duplicate panels.
 * <p>
 * List edits of one guild are serialized, and none is saved if the enabled entries would need
 * more menus than one panel message holds.
 */
@Service
@Slf4j
public class ReactionPanelManager {

    private static final String PANEL_KEY_PREFIX = "reaction-roles:";

    private final ReactionRoleStore roleStore;
    private final PanelRecordStore panelStore;
    private final DiscordPlatformClient client;
    private final PanelSettings settings;
    private final GuardianMetrics metrics;

    private final LoadingCache<Long, ReentrantLock> listLocks = Caffeine.newBuilder()
            .weakValues()
            .build(guildId -> new ReentrantLock());

    public ReactionPanelManager(ReactionRoleStore roleStore, PanelRecordStore panelStore,
                                DiscordPlatformClient client, PanelSettings settings, GuardianMetrics metrics) {
        this.roleStore = roleStore;
        this.panelStore = panelStore;
        this.client = client;
        this.settings = settings;
        this.metrics = metrics;
    }

    public static String panelKey(long guildId) {
        return PANEL_KEY_PREFIX + guildId;
    }

    // role list

    public List<ReactionRoleEntry> list(long guildId) {
        return roleStore.findByGuild(guildId);
    }

    /**
     * Appends a role to the list.
     *
     * @throws ReactionRoleConfigException if the role is already listed, cannot be offered, or the
     *         panel would need more menus than one message holds
     */
    public ReactionRoleEntry add(long guildId, long roleId, String groupKey, String label, String emoji) {
        return withListLock(guildId, () -> {
            List<ReactionRoleEntry> entries = new ArrayList<>(roleStore.findByGuild(guildId));
            if (indexOf(entries, roleId) >= 0) {
                throw new ReactionRoleConfigException("ROLE_ALREADY_CONFIGURED",
                        "Role " + roleId + " is already on the reaction-role list");
            }
            validateOfferable(guildId, roleId);

            ReactionRoleEntry entry = ReactionRoleEntry.builder()
                    .guildId(guildId)
                    .roleId(roleId)
                    .groupKey(groupKey == null || groupKey.isBlank() ? ReactionRoleEntry.DEFAULT_GROUP : groupKey.trim())
                    .label(label)
                    .emoji(emoji)
                    .orderIndex(entries.size())
                    .build();
            entries.add(entry);
            save(guildId, entries);
            log.info("Reaction role added: guildId={} roleId={} group={}", guildId, roleId, entry.getGroupKey());
            return entry;
        });
    }

    public void remove(long guildId, long roleId) {
        withListLock(guildId, () -> {
            List<ReactionRoleEntry> entries = new ArrayList<>(roleStore.findByGuild(guildId));
            entries.remove(requireIndex(guildId, entries, roleId));
            save(guildId, entries);
            log.info("Reaction role removed: guildId={} roleId={}", guildId, roleId);
            return null;
        });
    }

    /**
     * @throws ReactionRoleConfigException if enabling the role would overflow the panel
     */
    public void setEnabled(long guildId, long roleId, boolean enabled) {
        update(guildId, roleId, entry -> entry.toBuilder().enabled(enabled).build());
    }

    public void relabel(long guildId, long roleId, String label, String emoji) {
        update(guildId, roleId, entry -> entry.toBuilder().label(label).emoji(emoji).build());
    }

    /**
     * Moves a role to {@code newIndex}, clamped to the list bounds.
     */
    public void reorder(long guildId, long roleId, int newIndex) {
        withListLock(guildId, () -> {
            List<ReactionRoleEntry> entries = new ArrayList<>(roleStore.findByGuild(guildId));
            ReactionRoleEntry moved = entries.remove(requireIndex(guildId, entries, roleId));
            entries.add(Math.max(0, Math.min(newIndex, entries.size())), moved);
            save(guildId, entries);
            return null;
        });
    }

    private void update(long guildId, long roleId, UnaryOperator<ReactionRoleEntry> change) {
        withListLock(guildId, () -> {
            List<ReactionRoleEntry> entries = new ArrayList<>(roleStore.findByGuild(guildId));
            int index = requireIndex(guildId, entries, roleId);
            entries.set(index, change.apply(entries.get(index)));
            save(guildId, entries);
            return null;
        });
    }

    private void save(long guildId, List<ReactionRoleEntry> entries) {
        int menus = PanelRenderer.menuCount(enabled(entries), settings.pageSize());
        if (menus > MessageContent.MAX_MENUS) {
            throw new ReactionRoleConfigException("PANEL_FULL", String.format(
                    "Panel would need %d menus, at most %d fit in one message", menus, MessageContent.MAX_MENUS));
        }
        List<ReactionRoleEntry> dense = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            dense.add(entries.get(i).toBuilder().guildId(guildId).orderIndex(i).build());
        }
        roleStore.replaceAll(guildId, dense);
    }

    private void validateOfferable(long guildId, long roleId) {
        RoleSnapshot role = findRole(guildId, roleId)
                .orElseThrow(() -> ReactionRoleConfigException.rejected(roleId, "role does not exist"));
        if (role.managed()) {
            throw ReactionRoleConfigException.rejected(roleId, "role is managed by an integration");
        }
        if (settings.isProtected(role.name())) {
            throw ReactionRoleConfigException.rejected(roleId, "role '" + role.name() + "' is protected");
        }
        if (role.position() >= botHighestPosition(guildId)) {
            throw ReactionRoleConfigException.rejected(roleId, "role is not below the bot's highest role");
        }
    }

    // panel

    /**
     * Brings the panel in line with the list: no call when the live message already shows the
     * current content, an edit when it is outdated, a new message (and channel if needed) when
     * it is gone.
     */
    public PanelRecord publish(long guildId) {
        return publish(guildId, false);
    }

    /**
     * Like {@link #publish} but always rewrites the message.
     */
    public PanelRecord repair(long guildId) {
        return publish(guildId, true);
    }

    private PanelRecord publish(long guildId, boolean force) {
        List<ReactionRoleEntry> entries = enabled(roleStore.findByGuild(guildId));
        MessageContent content = PanelRenderer.render(entries, roleNames(guildId, entries), settings);
        String hash = PanelRenderer.contentHash(content);

        Optional<PanelRecord> existing = panelStore.find(panelKey(guildId));
        if (existing.isPresent()
                && client.messageExists(existing.get().getChannelId(), existing.get().getMessageId())) {
            PanelRecord record = existing.get();
            if (!force && hash.equals(record.getContentHash())) {
                log.debug("Panel unchanged: guildId={} messageId={}", guildId, record.getMessageId());
                return record;
            }
            client.editMessage(record.getChannelId(), record.getMessageId(), content);
            record.setContentHash(hash);
            panelStore.save(record);
            log.info("Panel updated: guildId={} messageId={} roles={}", guildId, record.getMessageId(), entries.size());
            return record;
        }
        return recreate(guildId, existing.orElse(null), content, hash);
    }

    private PanelRecord recreate(long guildId, PanelRecord stale, MessageContent content, String hash) {
        long channelId = resolveChannel(guildId, stale);
        long messageId = client.createMessage(channelId, content);
        PanelRecord record = PanelRecord.builder()
                .panelKey(panelKey(guildId))
                .guildId(guildId)
                .channelId(channelId)
                .messageId(messageId)
                .contentHash(hash)
                .build();
        panelStore.save(record);
        if (stale != null) {
            metrics.recordPanelRepair();
            log.warn("Panel recreated: guildId={} oldMessageId={} newMessageId={} channelId={}",
                    guildId, stale.getMessageId(), messageId, channelId);
        } else {
            log.info("Panel published: guildId={} messageId={} channelId={}", guildId, messageId, channelId);
        }
        return record;
    }

    private long resolveChannel(long guildId, PanelRecord stale) {
        List<ChannelSnapshot> channels = client.listChannels(guildId);
        if (stale != null) {
            for (ChannelSnapshot channel : channels) {
                if (channel.id() == stale.getChannelId() && channel.type() == ChannelSnapshot.Type.TEXT) {
                    return channel.id();
                }
            }
        }
        String wanted = ConfigurationValidator.normalize(settings.channelName());
        for (ChannelSnapshot channel : channels) {
            if (channel.type() == ChannelSnapshot.Type.TEXT
                    && ConfigurationValidator.normalize(channel.name()).equalsIgnoreCase(wanted)) {
                return channel.id();
            }
        }
        long created = client.createChannel(guildId, null, settings.channelName(), ChannelKind.TEXT);
        log.info("Panel channel created: guildId={} channelId={} name='{}'", guildId, created, settings.channelName());
        return created;
    }

    /**
     * Checks every stored panel and recreates those whose message is gone.
     *
     * @return number of panels recreated
     */
    public int repairAll() {
        int repaired = 0;
        for (PanelRecord record : panelStore.findAll()) {
            try {
                if (!client.messageExists(record.getChannelId(), record.getMessageId())) {
                    repair(record.getGuildId());
                    repaired++;
                }
            } catch (RuntimeException e) {
                log.error("Panel integrity check failed: guildId={} panelKey={} error={}",
                        record.getGuildId(), record.getPanelKey(), e.getMessage(), e);
            }
        }
        return repaired;
    }

    // member selections

    /**
     * Adds or removes one listed role on a member.
     *
     * @return the member's enabled listed roles after the change
     * @throws RoleSelectionException before any mutation if the role may not be selected
     */
    public Set<Long> applySelection(long guildId, long userId, long roleId, boolean selected) {
        List<ReactionRoleEntry> entries = roleStore.findByGuild(guildId);
        int index = indexOf(entries, roleId);
        if (index < 0) {
            throw new RoleSelectionException(RoleSelectionException.Reason.NOT_CONFIGURED, roleId,
                    "Role " + roleId + " is not on the reaction-role list");
        }
        if (!entries.get(index).isEnabled()) {
            throw new RoleSelectionException(RoleSelectionException.Reason.DISABLED, roleId,
                    "Role " + roleId + " is currently disabled");
        }
        List<RoleSnapshot> roles = client.listRoles(guildId);
        RoleSnapshot role = roles.stream().filter(r -> r.id() == roleId).findFirst()
                .orElseThrow(() -> new RoleSelectionException(RoleSelectionException.Reason.UNKNOWN_ROLE, roleId,
                        "Role " + roleId + " no longer exists"));
        if (settings.isProtected(role.name())) {
            throw new RoleSelectionException(RoleSelectionException.Reason.PROTECTED, roleId,
                    "Role '" + role.name() + "' is protected");
        }
        if (role.managed()) {
            throw new RoleSelectionException(RoleSelectionException.Reason.MANAGED, roleId,
                    "Role '" + role.name() + "' is managed by an integration");
        }
        if (role.position() >= highestPosition(roles, client.getSelfMember(guildId))) {
            throw new RoleSelectionException(RoleSelectionException.Reason.ABOVE_BOT_HIERARCHY, roleId,
                    "Role '" + role.name() + "' is not below the bot's highest role");
        }

        MemberSnapshot member = client.getMember(guildId, userId);
        Set<Long> held = new LinkedHashSet<>(member.roleIds());
        if (selected && !member.hasRole(roleId)) {
            client.addMemberRole(guildId, userId, roleId);
            held.add(roleId);
        } else if (!selected && member.hasRole(roleId)) {
            client.removeMemberRole(guildId, userId, roleId);
            held.remove(roleId);
        }
        log.debug("Selection applied: guildId={} userId={} roleId={} selected={}", guildId, userId, roleId, selected);

        Set<Long> result = new LinkedHashSet<>();
        for (ReactionRoleEntry entry : enabled(entries)) {
            if (held.contains(entry.getRoleId())) {
                result.add(entry.getRoleId());
            }
        }
        return result;
    }

    /**
     * Removes every enabled listed role the member holds.
     *
     * @return the roles removed
     */
    public Set<Long> clear(long guildId, long userId) {
        MemberSnapshot member = client.getMember(guildId, userId);
        Set<Long> removed = new LinkedHashSet<>();
        for (ReactionRoleEntry entry : enabled(roleStore.findByGuild(guildId))) {
            if (member.hasRole(entry.getRoleId())) {
                client.removeMemberRole(guildId, userId, entry.getRoleId());
                removed.add(entry.getRoleId());
            }
        }
        log.info("Selections cleared: guildId={} userId={} removed={}", guildId, userId, removed.size());
        return removed;
    }

    // helpers

    private <T> T withListLock(long guildId, Supplier<T> action) {
        ReentrantLock lock = listLocks.get(guildId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private Optional<RoleSnapshot> findRole(long guildId, long roleId) {
        return client.listRoles(guildId).stream().filter(r -> r.id() == roleId).findFirst();
    }

    private int botHighestPosition(long guildId) {
        return highestPosition(client.listRoles(guildId), client.getSelfMember(guildId));
    }

    private static int highestPosition(List<RoleSnapshot> roles, MemberSnapshot self) {
        int highest = 0;
        for (RoleSnapshot role : roles) {
            if (self.hasRole(role.id())) {
                highest = Math.max(highest, role.position());
            }
        }
        return highest;
    }

    private Map<Long, String> roleNames(long guildId, List<ReactionRoleEntry> entries) {
        Map<Long, String> names = new HashMap<>();
        if (entries.isEmpty()) {
            return names;
        }
        client.listRoles(guildId).forEach(role -> names.put(role.id(), role.name()));
        return names;
    }

    private static List<ReactionRoleEntry> enabled(List<ReactionRoleEntry> entries) {
        return entries.stream().filter(ReactionRoleEntry::isEnabled).toList();
    }

    private static int indexOf(List<ReactionRoleEntry> entries, long roleId) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getRoleId() == roleId) {
                return i;
            }
        }
        return -1;
    }

    private static int requireIndex(long guildId, List<ReactionRoleEntry> entries, long roleId) {
        int index = indexOf(entries, roleId);
        if (index < 0) {
            throw ReactionRoleConfigException.notConfigured(guildId, roleId);
        }
        return index;
    }
}
