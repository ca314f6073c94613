package io.ragent.core.provider;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Providers keyed by normalized name, so {@code "LM-Studio"} and {@code "lm_studio"} resolve to
 * the same entry. Each name can be registered once.
 */
public final class ProviderRegistry {
    private final Map<String, LlmProvider> providers = new ConcurrentHashMap<>();

    public void register(LlmProvider provider) {
        String key = normalize(provider.name());
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        if (providers.putIfAbsent(key, provider) != null) {
            throw new IllegalArgumentException("Provider already registered: " + provider.name());
        }
    }

    public Optional<LlmProvider> find(String name) {
        return Optional.ofNullable(providers.get(normalize(name)));
    }

    public List<String> names() {
        return providers.keySet().stream().sorted().toList();
    }

    static String normalize(String name) {
        return name == null ? "" : name.strip().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
