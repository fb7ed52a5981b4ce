package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.overhaul.model.ConfigurationValidator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Template name to remote identifier for everything known to exist in a guild.
 * Creation steps consult it first and reuse what is already there.
 */
public class KnownState {

    private final Map<String, Long> roles = new LinkedHashMap<>();
    private final Map<String, Long> categories = new LinkedHashMap<>();
    private final Map<String, Long> channels = new LinkedHashMap<>();

    public static KnownState empty() {
        return new KnownState();
    }

    public static String channelKey(String category, String channel) {
        return key(category) + "/" + key(channel);
    }

    private static String key(String name) {
        return ConfigurationValidator.normalize(name);
    }

    public synchronized Optional<Long> role(String name) {
        return Optional.ofNullable(roles.get(key(name)));
    }

    public synchronized void putRole(String name, long id) {
        roles.put(key(name), id);
    }

    public synchronized Optional<Long> category(String name) {
        return Optional.ofNullable(categories.get(key(name)));
    }

    public synchronized void putCategory(String name, long id) {
        categories.put(key(name), id);
    }

    public synchronized Optional<Long> channel(String category, String channel) {
        return Optional.ofNullable(channels.get(channelKey(category, channel)));
    }

    public synchronized void putChannel(String category, String channel, long id) {
        channels.put(channelKey(category, channel), id);
    }

    synchronized void putChannelByKey(String channelKey, long id) {
        channels.put(channelKey, id);
    }

    public synchronized Map<String, Long> roles() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(roles));
    }

    public synchronized Map<String, Long> categories() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(categories));
    }

    public synchronized Map<String, Long> channels() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(channels));
    }

    @Override
    public synchronized String toString() {
        return "KnownState{roles=" + roles.size() + ", categories=" + categories.size()
                + ", channels=" + channels.size() + "}";
    }
}
