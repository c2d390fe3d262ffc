package com.example.filegate.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("StorageRepository")
class StorageRepositoryTest {

    private static ResourceStorage storage(int uid, boolean isDefault, boolean online) {
        ResourceStorage storage = mock(ResourceStorage.class);
        when(storage.getUid()).thenReturn(uid);
        when(storage.isDefault()).thenReturn(isDefault);
        when(storage.isOnline()).thenReturn(online);
        return storage;
    }

    @Nested
    @DisplayName("default storage")
    class DefaultStorage {

        @Test
        @DisplayName("should return the single online default storage")
        void shouldReturnDefaultStorage() {
            ResourceStorage fileadmin = storage(1, true, true);
            StorageRepository repository = new StorageRepository(List.of(fileadmin, storage(2, false, true)));

            StepVerifier.create(repository.findDefaultStorage())
                    .expectNext(fileadmin)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should be empty without storages")
        void shouldBeEmptyWithoutStorages() {
            StepVerifier.create(new StorageRepository(List.of()).findDefaultStorage())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should be empty when no storage is flagged as default")
        void shouldBeEmptyWithoutDefaultFlag() {
            StorageRepository repository = new StorageRepository(List.of(storage(1, false, true)));

            StepVerifier.create(repository.findDefaultStorage())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should be empty when several storages are flagged as default")
        void shouldBeEmptyWithAmbiguousDefault() {
            StorageRepository repository = new StorageRepository(List.of(
                    storage(1, true, true), storage(2, true, true)));

            StepVerifier.create(repository.findDefaultStorage())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should be empty when the default storage is offline")
        void shouldBeEmptyWhenOffline() {
            StorageRepository repository = new StorageRepository(List.of(storage(1, true, false)));

            StepVerifier.create(repository.findDefaultStorage())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("should reject duplicate uids")
        void shouldRejectDuplicateUid() {
            List<ResourceStorage> storages = List.of(storage(1, true, true), storage(1, false, true));

            assertThatThrownBy(() -> new StorageRepository(storages))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Duplicate storage uid: 1");
        }

        @Test
        @DisplayName("should look up storages by uid in registration order")
        void shouldFindByUid() {
            ResourceStorage first = storage(1, true, true);
            ResourceStorage second = storage(2, false, true);
            StorageRepository repository = new StorageRepository(List.of(first, second));

            assertThat(repository.findByUid(2)).containsSame(second);
            assertThat(repository.findByUid(3)).isEmpty();
            assertThat(repository.getAll()).containsExactly(first, second);
        }
    }
}
