package com.example.filegate.storage;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the configured storages.
 *
 * <p>The default storage is the single storage flagged as default and online. With zero or
 * several flagged storages there is no default storage.</p>
 */
@Slf4j
public class StorageRepository {

    private final Map<Integer, ResourceStorage> storagesByUid;

    public StorageRepository(Collection<? extends ResourceStorage> storages) {
        Map<Integer, ResourceStorage> byUid = new LinkedHashMap<>();
        for (ResourceStorage storage : storages) {
            if (byUid.putIfAbsent(storage.getUid(), storage) != null) {
                throw new IllegalStateException("Duplicate storage uid: " + storage.getUid());
            }
        }
        this.storagesByUid = byUid;

        long defaults = storages.stream().filter(ResourceStorage::isDefault).count();
        if (defaults != 1) {
            log.warn("Expected exactly one default storage but found {}; protected files will not be served",
                    defaults);
        }
        log.info("Registered {} storage(s): {}", byUid.size(), byUid.values());
    }

    public List<ResourceStorage> getAll() {
        return List.copyOf(storagesByUid.values());
    }

    public Optional<ResourceStorage> findByUid(int uid) {
        return Optional.ofNullable(storagesByUid.get(uid));
    }

    /**
     * Completes empty when no usable default storage is configured.
     */
    public Mono<ResourceStorage> findDefaultStorage() {
        return Mono.fromSupplier(this::defaultStorage)
                .flatMap(Mono::justOrEmpty);
    }

    private Optional<ResourceStorage> defaultStorage() {
        List<ResourceStorage> defaults = storagesByUid.values().stream()
                .filter(ResourceStorage::isDefault)
                .toList();
        if (defaults.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(defaults.get(0))
                .filter(ResourceStorage::isOnline);
    }
}
